package com.scholary.recordings.service;

import com.scholary.recordings.blobstore.BlobNames;
import com.scholary.recordings.blobstore.BlobStore;
import com.scholary.recordings.callrecord.CallRecordService;
import com.scholary.recordings.callrecord.CallerIdentity;
import com.scholary.recordings.callrecord.RecordingAttacher;
import com.scholary.recordings.error.ConflictException;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.job.ChunkedJob;
import com.scholary.recordings.job.IngestionJobQueue;
import com.scholary.recordings.job.SimpleJob;
import com.scholary.recordings.location.RecordingLocation;
import com.scholary.recordings.logging.StructuredLogger;
import com.scholary.recordings.media.AudioFormat;
import com.scholary.recordings.presign.PresignedUrlIssuer;
import com.scholary.recordings.session.AppendResult;
import com.scholary.recordings.session.UploadSession;
import com.scholary.recordings.session.UploadSessionStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * The upload protocol: presign, simple upload, S3 confirm, and chunked init/append/finalize.
 *
 * <p>Every operation resolves the call record and checks the caller's access before touching
 * storage. Simple uploads and chunked finalize only enqueue work; the blob is produced and attached
 * by the finalization worker.
 */
@Service
public class RecordingIngestionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingIngestionService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String DEFAULT_FILE_NAME = "recording" + AudioFormat.DEFAULT.extension();

  private final CallRecordService callRecordService;
  private final UploadSessionStore sessionStore;
  private final IngestionJobQueue jobQueue;
  private final RecordingAttacher attacher;
  private final BlobStore blobStore;
  private final PresignedUrlIssuer urlIssuer;
  private final Path uploadTempDir;

  public RecordingIngestionService(
      CallRecordService callRecordService,
      UploadSessionStore sessionStore,
      IngestionJobQueue jobQueue,
      RecordingAttacher attacher,
      BlobStore blobStore,
      PresignedUrlIssuer urlIssuer,
      @Qualifier("uploadTempDir") Path uploadTempDir) {
    this.callRecordService = callRecordService;
    this.sessionStore = sessionStore;
    this.jobQueue = jobQueue;
    this.attacher = attacher;
    this.blobStore = blobStore;
    this.urlIssuer = urlIssuer;
    this.uploadTempDir = uploadTempDir;
  }

  /** Issue a URL for a direct upload to storage. */
  public PresignedUpload presign(
      CallerIdentity caller, UUID callRecordId, String contentType, String fileName) {
    callRecordService.requireAccessible(caller, callRecordId);

    AudioFormat format =
        AudioFormat.fromContentType(contentType)
            .or(() -> AudioFormat.fromFileName(fileName))
            .orElse(AudioFormat.DEFAULT);
    String objectKey = BlobNames.newObjectKey(callRecordId, format);
    PresignedUpload upload =
        new PresignedUpload(
            objectKey, format.contentType(), urlIssuer.issueUploadUrl(objectKey, format.contentType()));
    LOGGER.info(
        "Issued upload URL: callRecordId={}, key={}, timeLimited={}",
        callRecordId,
        objectKey,
        upload.url().isTimeLimited());
    return upload;
  }

  /**
   * Attach an object the client already uploaded to a presigned URL.
   *
   * <p>Confirming the key that is already attached succeeds again, so a client may safely retry.
   *
   * @throws ValidationException if the key was not issued by this service for this call record
   * @throws NotFoundException if no object exists under the key
   * @throws ConflictException if a different recording is already attached
   */
  public RecordingLocation confirmRemote(CallerIdentity caller, UUID callRecordId, String objectKey) {
    callRecordService.requireAccessible(caller, callRecordId);
    if (objectKey == null || objectKey.isBlank()) {
      throw new ValidationException("object_key is required");
    }
    UUID issuedFor =
        BlobNames.issuedFor(objectKey)
            .orElseThrow(
                () ->
                    new ValidationException(
                        "object_key was not issued by this service: " + objectKey));
    if (!issuedFor.equals(callRecordId)) {
      LOGGER.warn(
          "Rejected confirm of key issued for another call record: callRecordId={}, key={}",
          callRecordId,
          objectKey);
      throw new ValidationException("object_key was not issued for call record " + callRecordId);
    }

    RecordingLocation location = RecordingLocation.remote(objectKey);
    if (!blobStore.exists(location)) {
      throw new NotFoundException(What.BLOB, objectKey);
    }

    try {
      attacher.attach(callRecordId, location);
    } catch (ConflictException e) {
      if (!location.equals(e.existing())) {
        throw e;
      }
      LOGGER.info("Remote recording already confirmed: callRecordId={}, key={}", callRecordId, objectKey);
    }
    return location;
  }

  /**
   * Start a chunked upload.
   *
   * @return the new session
   */
  public UploadSession initSession(
      CallerIdentity caller, UUID callRecordId, Integer expectedChunks, String fileName) {
    callRecordService.requireAccessible(caller, callRecordId);
    if (expectedChunks == null) {
      throw new ValidationException("expected_chunks is required");
    }

    String name = fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName;
    String sessionId = sessionStore.init(callRecordId, name, expectedChunks);
    return sessionStore
        .find(sessionId)
        .orElseThrow(() -> new NotFoundException(What.UPLOAD_SESSION, sessionId));
  }

  /**
   * Store one chunk of a session.
   *
   * @param claimedCallRecordId call record named by the client, if any; must match the session's
   */
  public AppendResult append(
      CallerIdentity caller,
      String sessionId,
      Integer index,
      byte[] bytes,
      UUID claimedCallRecordId) {
    if (index == null) {
      throw new ValidationException("index is required");
    }
    requireSession(caller, sessionId, claimedCallRecordId);

    AppendResult result = sessionStore.append(sessionId, index, bytes);
    structuredLogger.logChunkAppended(sessionId, index, result.chunksReceived(), result.totalSize());
    return result;
  }

  /**
   * Queue finalization of a session. Repeated requests for the same session return the same job
   * while it is pending or running.
   *
   * @param expectedChunks declared chunk count; defaults to the count given at init
   */
  public IngestionAccepted finalizeSession(
      CallerIdentity caller, String sessionId, Integer expectedChunks, UUID claimedCallRecordId) {
    UploadSession session = requireSession(caller, sessionId, claimedCallRecordId);
    int chunks = expectedChunks == null ? session.expectedChunks() : expectedChunks;
    if (chunks < 1) {
      throw new ValidationException("expected_chunks must be >= 1");
    }

    UUID jobId = jobQueue.enqueue(new ChunkedJob(sessionId, chunks, session.callRecordId()));
    return new IngestionAccepted(session.callRecordId(), jobId);
  }

  /**
   * Accept a whole recording in one request. The content is spooled to a temporary file and the
   * worker moves it into the blob store.
   */
  public IngestionAccepted acceptSimple(
      CallerIdentity caller, UUID callRecordId, InputStream content, String fileName) {
    callRecordService.requireAccessible(caller, callRecordId);
    if (content == null) {
      throw new ValidationException("file is required");
    }

    String name = fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName;
    Path temp = uploadTempDir.resolve(UUID.randomUUID() + ".upload");
    long bytes;
    try {
      bytes = Files.copy(content, temp);
    } catch (IOException e) {
      deleteTemp(temp);
      throw new TransientStorageException("Failed to spool upload", e);
    }
    if (bytes == 0) {
      deleteTemp(temp);
      throw new ValidationException("file must not be empty");
    }

    try {
      UUID jobId = jobQueue.enqueue(new SimpleJob(temp.toString(), callRecordId, name));
      LOGGER.info(
          "Simple upload accepted: callRecordId={}, bytes={}, jobId={}", callRecordId, bytes, jobId);
      return new IngestionAccepted(callRecordId, jobId);
    } catch (RuntimeException e) {
      deleteTemp(temp);
      throw e;
    }
  }

  private UploadSession requireSession(
      CallerIdentity caller, String sessionId, UUID claimedCallRecordId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new ValidationException("session_id is required");
    }
    UploadSession session =
        sessionStore
            .find(sessionId)
            .orElseThrow(() -> new NotFoundException(What.UPLOAD_SESSION, sessionId));
    callRecordService.requireAccessible(caller, session.callRecordId());
    if (claimedCallRecordId != null && !claimedCallRecordId.equals(session.callRecordId())) {
      throw new ValidationException("session_id belongs to a different call record");
    }
    return session;
  }

  private static void deleteTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove spooled upload {}: {}", temp, e.getMessage());
    }
  }
}
