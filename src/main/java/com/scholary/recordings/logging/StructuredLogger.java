package com.scholary.recordings.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log ingestion events with structured fields that can be queried in the
 * log store.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk appended event. */
  public void logChunkAppended(String sessionId, int chunkIndex, int chunksReceived, long totalSize) {
    try {
      MDC.put("event_type", "chunk_appended");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("chunksReceived", String.valueOf(chunksReceived));
      MDC.put("totalSize", String.valueOf(totalSize));

      logger.debug(
          "Chunk appended: session={}, index={}, received={}, totalSize={}",
          sessionId,
          chunkIndex,
          chunksReceived,
          totalSize);
    } finally {
      clearEventFields();
    }
  }

  /** Log job enqueued event. */
  public void logJobEnqueued(String jobId, String jobType, String callRecordId) {
    try {
      MDC.put("event_type", "job_enqueued");
      MDC.put("jobType", jobType);

      logger.info(
          "Ingestion job enqueued: jobId={}, type={}, callRecordId={}", jobId, jobType, callRecordId);
    } finally {
      clearEventFields();
    }
  }

  /** Log recording attached event. */
  public void logRecordingAttached(String callRecordId, String location) {
    try {
      MDC.put("event_type", "recording_attached");
      MDC.put("location", location);

      logger.info("Recording attached: callRecordId={}, location={}", callRecordId, location);
    } finally {
      clearEventFields();
    }
  }

  /** Log job retry event. */
  public void logJobRetry(
      String jobId, int attempt, int maxAttempts, long backoffMs, String errorType, String message) {
    try {
      MDC.put("event_type", "job_retry");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Ingestion job retry: jobId={}, attempt={}/{}, backoff={}ms, error={}, message={}",
          jobId,
          attempt,
          maxAttempts,
          backoffMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job cancelled event. */
  public void logJobCancelled(String jobId, String reason) {
    try {
      MDC.put("event_type", "job_cancelled");
      MDC.put("cancelReason", reason);

      logger.info("Ingestion job cancelled: jobId={}, reason={}", jobId, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job permanently failed event. */
  public void logJobFailed(String jobId, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Ingestion job failed permanently: jobId={}, attempts={}, error={}, message={}",
          jobId,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String callRecordId) {
    MDC.put("jobId", jobId);
    MDC.put("callRecordId", callRecordId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("callRecordId");
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String callRecordId, String sessionId) {
    if (callRecordId != null) {
      MDC.put("callRecordId", callRecordId);
    }
    if (sessionId != null) {
      MDC.put("sessionId", sessionId);
    }
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("callRecordId");
    MDC.remove("sessionId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("chunksReceived");
    MDC.remove("totalSize");
    MDC.remove("jobType");
    MDC.remove("location");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
    MDC.remove("cancelReason");
  }
}
