package com.scholary.recordings.api;

import com.scholary.recordings.job.CancelReason;
import com.scholary.recordings.job.IngestionJobEntity;
import com.scholary.recordings.job.JobStatus;
import com.scholary.recordings.job.JobType;
import java.time.Instant;
import java.util.UUID;

/**
 * State of an ingestion job.
 *
 * <p>Failed jobs keep their temporary artifacts for diagnosis; {@code lastError} says why.
 */
public record JobStatusResponse(
    UUID jobId,
    JobType type,
    UUID callRecordId,
    JobStatus status,
    int attempts,
    String lastError,
    CancelReason cancelReason,
    Instant createdAt,
    Instant updatedAt) {

  static JobStatusResponse from(IngestionJobEntity job) {
    return new JobStatusResponse(
        job.getId(),
        job.getType(),
        job.getCallRecordId(),
        job.getStatus(),
        job.getAttempts(),
        job.getLastError(),
        job.getCancelReason(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
