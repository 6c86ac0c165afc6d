package com.scholary.recordings.error;

/** A session, call record, recording or stored blob does not exist. */
public class NotFoundException extends RecordingException {

  /** What was missing. */
  public enum What {
    UPLOAD_SESSION("Upload session not found"),
    CALL_RECORD("Call record not found"),
    RECORDING("Recording not found"),
    BLOB("Recording file not found"),
    JOB("Ingestion job not found");

    private final String message;

    What(String message) {
      this.message = message;
    }
  }

  private final What what;

  public NotFoundException(What what, String id) {
    super(what.message + ": " + id);
    this.what = what;
  }

  public NotFoundException(What what, String id, Throwable cause) {
    super(what.message + ": " + id, cause);
    this.what = what;
  }

  public What what() {
    return what;
  }

  /** Client-facing message without the identifier. */
  public String publicMessage() {
    return what.message;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.NOT_FOUND;
  }
}
