package com.scholary.recordings.error;

/** The caller may not act on the requested call record. */
public class AuthorizationException extends RecordingException {

  public AuthorizationException(String message) {
    super(message);
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.AUTHORIZATION_ERROR;
  }
}
