package com.scholary.recordings.job;

import java.util.UUID;

/** Move a single-request upload from its temporary file into the blob store. */
public record SimpleJob(String tempPath, UUID callRecordId, String fileName)
    implements IngestionJob {

  @Override
  public JobType type() {
    return JobType.SIMPLE;
  }
}
