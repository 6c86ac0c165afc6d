package com.scholary.recordings.job;

import java.util.UUID;

/** Finalize a chunked upload session. */
public record ChunkedJob(String sessionId, int expectedChunks, UUID callRecordId)
    implements IngestionJob {

  @Override
  public JobType type() {
    return JobType.CHUNKED;
  }
}
