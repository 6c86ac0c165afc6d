package com.scholary.recordings.error;

/** The request is malformed. Raised before any storage is touched. */
public class ValidationException extends RecordingException {

  public ValidationException(String message) {
    super(message);
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.VALIDATION_ERROR;
  }
}
