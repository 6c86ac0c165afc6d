package com.scholary.recordings.error;

/**
 * An I/O failure against the blob store, the session store or the object store.
 *
 * <p>Retryable. The finalization worker retries it up to its attempt limit; request handlers report
 * it as a generic server error.
 */
public class TransientStorageException extends RecordingException {

  public TransientStorageException(String message, Throwable cause) {
    super(message, cause);
  }

  public TransientStorageException(String message) {
    super(message);
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.SERVER_ERROR;
  }
}
