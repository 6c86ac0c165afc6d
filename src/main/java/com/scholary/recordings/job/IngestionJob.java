package com.scholary.recordings.job;

import java.util.UUID;

/**
 * Work handed to the finalization worker: turn uploaded bytes into a stored recording and attach it
 * to its call record. Immutable once enqueued.
 */
public interface IngestionJob {

  UUID callRecordId();

  JobType type();
}
