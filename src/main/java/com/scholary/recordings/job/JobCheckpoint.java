package com.scholary.recordings.job;

import com.scholary.recordings.location.RecordingLocation;
import java.util.Optional;

/**
 * Progress a job keeps across attempts.
 *
 * <p>Once a blob has been produced it is staged here before attaching. A retry after a failed
 * attach finds the staged blob and goes straight to attaching instead of looking for an upload
 * session that no longer exists.
 */
public interface JobCheckpoint {

  Optional<RecordingLocation> stagedLocation();

  void stage(RecordingLocation location);
}
