package com.scholary.recordings.error;

/** A {@code Range} header that cannot be served for a blob of the given size. */
public class RangeNotSatisfiableException extends RecordingException {

  private final long size;

  public RangeNotSatisfiableException(String range, long size) {
    super(String.format("Range not satisfiable: range=%s, size=%d", range, size));
    this.size = size;
  }

  /** Size of the blob, reported back as {@code Content-Range: bytes *}{@code /size}. */
  public long size() {
    return size;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.INVALID_RANGE;
  }
}
