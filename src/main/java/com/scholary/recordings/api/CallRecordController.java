package com.scholary.recordings.api;

import com.scholary.recordings.callrecord.CallRecord;
import com.scholary.recordings.callrecord.CallRecordService;
import com.scholary.recordings.callrecord.CallerIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Call logging. A call record exists before any recording is uploaded for it. */
@RestController
@Tag(name = "Call records", description = "Logged call attempts")
public class CallRecordController {

  private final CallRecordService callRecordService;

  public CallRecordController(CallRecordService callRecordService) {
    this.callRecordService = callRecordService;
  }

  @PostMapping("/api/leads/{leadId}/calls")
  @ResponseStatus(HttpStatus.CREATED)
  @Operation(summary = "Log a call attempt by the calling agent")
  public CallRecordResponse logCall(
      CallerIdentity caller,
      @PathVariable String leadId,
      @Valid @RequestBody LogCallRequest request) {
    CallRecord record =
        callRecordService.logCall(caller, leadId, request.outcome(), request.durationSeconds());
    return CallRecordResponse.from(record);
  }

  @GetMapping("/api/call-records/{id}")
  @Operation(summary = "Get a call record")
  public CallRecordResponse get(CallerIdentity caller, @PathVariable UUID id) {
    return CallRecordResponse.from(callRecordService.requireAccessible(caller, id));
  }
}
