package com.scholary.recordings.job;

import com.scholary.recordings.location.RecordingLocation;
import java.util.UUID;

/**
 * A job this process has claimed and is about to run.
 *
 * @param attempt the attempt number being started, from 1
 * @param stagedLocation blob produced by an earlier attempt, or {@code null}
 */
public record ClaimedJob(UUID jobId, IngestionJob job, int attempt, RecordingLocation stagedLocation) {}
