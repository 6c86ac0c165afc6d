package com.scholary.recordings.api;

/** Error envelope: {@code {"error": {"code": ..., "message": ...}}}. */
public record ErrorResponse(Body error) {

  public record Body(String code, String message) {}

  public static ErrorResponse of(String code, String message) {
    return new ErrorResponse(new Body(code, message));
  }
}
