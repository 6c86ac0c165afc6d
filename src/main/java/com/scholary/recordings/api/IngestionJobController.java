package com.scholary.recordings.api;

import com.scholary.recordings.callrecord.CallRecordService;
import com.scholary.recordings.callrecord.CallerIdentity;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.job.IngestionJobEntity;
import com.scholary.recordings.job.IngestionJobQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Status of queued uploads, for clients polling after a 202 and for operators. */
@RestController
@RequestMapping("/api/ingestion-jobs")
@Tag(name = "Ingestion jobs", description = "Asynchronous finalization status")
public class IngestionJobController {

  private final IngestionJobQueue jobQueue;
  private final CallRecordService callRecordService;

  public IngestionJobController(IngestionJobQueue jobQueue, CallRecordService callRecordService) {
    this.jobQueue = jobQueue;
    this.callRecordService = callRecordService;
  }

  @GetMapping("/{jobId}")
  @Operation(summary = "Get the status of an ingestion job")
  public JobStatusResponse get(CallerIdentity caller, @PathVariable UUID jobId) {
    IngestionJobEntity job =
        jobQueue.find(jobId).orElseThrow(() -> new NotFoundException(What.JOB, jobId.toString()));
    if (!caller.admin()) {
      callRecordService.requireAccessible(caller, job.getCallRecordId());
    }
    return JobStatusResponse.from(job);
  }
}
