package com.scholary.recordings.error;

/**
 * Finalize was requested before every declared chunk arrived.
 *
 * <p>Terminal for the finalization worker: once the client asked to finalize, the missing chunks
 * are not coming.
 */
public class IncompleteUploadException extends RecordingException {

  private final int expectedChunks;
  private final int receivedChunks;

  public IncompleteUploadException(String sessionId, int expectedChunks, int receivedChunks) {
    super(
        String.format(
            "Incomplete upload - not all chunks received: session=%s, expected=%d, received=%d",
            sessionId, expectedChunks, receivedChunks));
    this.expectedChunks = expectedChunks;
    this.receivedChunks = receivedChunks;
  }

  public int expectedChunks() {
    return expectedChunks;
  }

  public int receivedChunks() {
    return receivedChunks;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.INCOMPLETE_UPLOAD;
  }
}
