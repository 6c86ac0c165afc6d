package com.scholary.recordings.job;

/**
 * Lifecycle of a persisted ingestion job.
 *
 * <p>{@code PENDING -> RUNNING -> (COMPLETED | CANCELLED | FAILED)}, with {@code RUNNING ->
 * PENDING} for retries and for jobs orphaned by a crash.
 */
public enum JobStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  CANCELLED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}
