package com.scholary.recordings.error;

import org.springframework.http.HttpStatus;

/** Error codes returned in the {@code error.code} field of failed API responses. */
public enum ErrorCode {
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
  INCOMPLETE_UPLOAD(HttpStatus.BAD_REQUEST),
  AUTHORIZATION_ERROR(HttpStatus.FORBIDDEN),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  CONFLICT(HttpStatus.CONFLICT),
  INVALID_RANGE(HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE),
  SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus status;

  ErrorCode(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
