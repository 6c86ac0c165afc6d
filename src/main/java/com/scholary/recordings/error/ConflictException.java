package com.scholary.recordings.error;

import com.scholary.recordings.location.RecordingLocation;

/**
 * A recording is already attached to the call record.
 *
 * <p>Attachment is single-assignment. The worker treats this as an idempotent success; direct
 * callers see a 409.
 */
public class ConflictException extends RecordingException {

  private final transient RecordingLocation existing;

  public ConflictException(String message, RecordingLocation existing) {
    super(message);
    this.existing = existing;
  }

  public ConflictException(String message) {
    this(message, null);
  }

  /** The location already attached, when known. */
  public RecordingLocation existing() {
    return existing;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.CONFLICT;
  }
}
