package com.scholary.recordings.error;

/**
 * Base type for failures of the recording ingestion and retrieval pipeline.
 *
 * <p>Unchecked, like the storage exceptions it usually wraps. The {@link ErrorCode} decides how the
 * failure is reported over HTTP.
 */
public abstract class RecordingException extends RuntimeException {

  protected RecordingException(String message) {
    super(message);
  }

  protected RecordingException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorCode errorCode();
}
