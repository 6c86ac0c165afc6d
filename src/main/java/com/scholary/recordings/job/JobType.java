package com.scholary.recordings.job;

/** Persisted discriminator of {@link IngestionJob} payloads. */
public enum JobType {
  CHUNKED(ChunkedJob.class),
  SIMPLE(SimpleJob.class);

  private final Class<? extends IngestionJob> payloadType;

  JobType(Class<? extends IngestionJob> payloadType) {
    this.payloadType = payloadType;
  }

  public Class<? extends IngestionJob> payloadType() {
    return payloadType;
  }
}
