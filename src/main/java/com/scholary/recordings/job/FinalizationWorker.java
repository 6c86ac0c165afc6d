package com.scholary.recordings.job;

import com.scholary.recordings.blobstore.BlobNames;
import com.scholary.recordings.blobstore.BlobStore;
import com.scholary.recordings.callrecord.RecordingAttacher;
import com.scholary.recordings.error.ConflictException;
import com.scholary.recordings.error.IncompleteUploadException;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.RecordingException;
import com.scholary.recordings.location.RecordingLocation;
import com.scholary.recordings.session.UploadSessionStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one attempt of an ingestion job: produce the recording blob, then attach it.
 *
 * <p>Outcomes that no retry can change are returned as a {@link JobOutcome}. Anything else is
 * thrown and the dispatcher decides whether to try again. Blobs that end up attached to nothing are
 * deleted before returning.
 */
@Component
public class FinalizationWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(FinalizationWorker.class);

  private final UploadSessionStore sessionStore;
  private final BlobStore blobStore;
  private final RecordingAttacher attacher;
  private final Clock clock;

  public FinalizationWorker(
      UploadSessionStore sessionStore,
      BlobStore blobStore,
      RecordingAttacher attacher,
      Clock clock) {
    this.sessionStore = sessionStore;
    this.blobStore = blobStore;
    this.attacher = attacher;
    this.clock = clock;
  }

  public JobOutcome process(IngestionJob job, JobCheckpoint checkpoint) {
    switch (job.type()) {
      case CHUNKED:
        return processChunked((ChunkedJob) job, checkpoint);
      case SIMPLE:
        return processSimple((SimpleJob) job, checkpoint);
      default:
        throw new IllegalArgumentException("Unknown job type: " + job.type());
    }
  }

  private JobOutcome processChunked(ChunkedJob job, JobCheckpoint checkpoint) {
    Optional<RecordingLocation> staged = checkpoint.stagedLocation();
    if (staged.isPresent()) {
      LOGGER.info("Resuming from staged recording: location={}", staged.get());
      return attach(job.callRecordId(), staged.get());
    }

    RecordingLocation location;
    try {
      location = sessionStore.finalizeUpload(job.sessionId(), job.expectedChunks());
    } catch (IncompleteUploadException e) {
      LOGGER.warn(
          "Upload incomplete, discarding session: sessionId={}, expected={}, received={}",
          job.sessionId(),
          e.expectedChunks(),
          e.receivedChunks());
      sessionStore.cancel(job.sessionId());
      return JobOutcome.cancelled(CancelReason.INCOMPLETE_UPLOAD);
    } catch (NotFoundException e) {
      if (e.what() != NotFoundException.What.UPLOAD_SESSION) {
        throw e;
      }
      LOGGER.warn("Upload session no longer exists: sessionId={}", job.sessionId());
      return JobOutcome.cancelled(CancelReason.UPLOAD_NOT_FOUND);
    }

    checkpoint.stage(location);
    return attach(job.callRecordId(), location);
  }

  private JobOutcome processSimple(SimpleJob job, JobCheckpoint checkpoint) {
    Optional<RecordingLocation> staged = checkpoint.stagedLocation();
    if (staged.isPresent()) {
      LOGGER.info("Resuming from staged recording: location={}", staged.get());
      return attach(job.callRecordId(), staged.get());
    }

    Path temp = Path.of(job.tempPath());
    if (!Files.exists(temp)) {
      LOGGER.warn("Uploaded file no longer exists: path={}", temp);
      return JobOutcome.cancelled(CancelReason.UPLOAD_NOT_FOUND);
    }

    // A failed put leaves the temp file for the next attempt.
    RecordingLocation location =
        blobStore.put(
            temp, BlobNames.recordingHint(job.callRecordId(), job.fileName(), clock.instant()));
    checkpoint.stage(location);
    deleteTemp(temp);
    return attach(job.callRecordId(), location);
  }

  private JobOutcome attach(UUID callRecordId, RecordingLocation location) {
    try {
      attacher.attach(callRecordId, location);
      return JobOutcome.completed();
    } catch (NotFoundException e) {
      if (e.what() != NotFoundException.What.CALL_RECORD) {
        throw e;
      }
      LOGGER.warn(
          "Call record gone, deleting orphaned recording: callRecordId={}, location={}",
          callRecordId,
          location);
      deleteBlob(location);
      return JobOutcome.cancelled(CancelReason.CALL_RECORD_NOT_FOUND);
    } catch (ConflictException e) {
      if (!location.equals(e.existing())) {
        deleteBlob(location);
      }
      return JobOutcome.completed();
    }
  }

  private void deleteBlob(RecordingLocation location) {
    try {
      blobStore.delete(location);
    } catch (RecordingException e) {
      LOGGER.warn("Failed to delete orphaned recording: location={}", location, e);
    }
  }

  private void deleteTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete uploaded temp file: path={}", temp, e);
    }
  }
}
