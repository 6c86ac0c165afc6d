package com.scholary.recordings.service;

import com.scholary.recordings.blobstore.BlobNames;
import com.scholary.recordings.blobstore.BlobStore;
import com.scholary.recordings.callrecord.CallRecord;
import com.scholary.recordings.callrecord.CallRecordService;
import com.scholary.recordings.callrecord.CallerIdentity;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.location.RecordingLocation;
import com.scholary.recordings.media.AudioFormat;
import com.scholary.recordings.presign.PresignedUrlIssuer;
import java.io.IOException;
import java.io.OutputStream;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serves attached recordings for playback.
 *
 * <p>Recordings in object storage are never proxied; the caller is redirected to a freshly issued
 * download URL. Local recordings are streamed in slices read through {@link BlobStore#readRange}, so
 * memory use is bounded whatever the file size.
 */
@Service
public class RecordingStreamingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingStreamingService.class);

  static final int SLICE_BYTES = 64 * 1024;

  private final CallRecordService callRecordService;
  private final BlobStore blobStore;
  private final PresignedUrlIssuer urlIssuer;

  public RecordingStreamingService(
      CallRecordService callRecordService, BlobStore blobStore, PresignedUrlIssuer urlIssuer) {
    this.callRecordService = callRecordService;
    this.blobStore = blobStore;
    this.urlIssuer = urlIssuer;
  }

  /**
   * Decide how to serve the recording of a call record.
   *
   * @param rangeHeader the request's {@code Range} header, or {@code null}
   * @throws com.scholary.recordings.error.AuthorizationException if the caller may not listen
   * @throws NotFoundException if the record or its recording does not exist
   * @throws com.scholary.recordings.error.RangeNotSatisfiableException if the range cannot be served
   */
  public Playback open(CallerIdentity caller, UUID callRecordId, String rangeHeader) {
    CallRecord record = callRecordService.requireAccessible(caller, callRecordId);
    RecordingLocation location =
        record
            .getRecordingLocation()
            .orElseThrow(() -> new NotFoundException(What.RECORDING, callRecordId.toString()));

    if (location.isRemote()) {
      LOGGER.info(
          "Redirecting playback to storage: callRecordId={}, key={}",
          callRecordId,
          location.objectKey());
      return Playback.redirect(urlIssuer.issueDownloadUrl(location.objectKey()).url());
    }
    return streamOf(location, rangeHeader);
  }

  /**
   * Serve an object uploaded through the same-origin upload endpoint.
   *
   * @throws NotFoundException if the key is not an issued key or has no object
   */
  public Playback openObject(String objectKey, String rangeHeader) {
    if (!BlobNames.isIssuedObjectKey(objectKey)) {
      throw new NotFoundException(What.BLOB, objectKey);
    }
    return streamOf(RecordingLocation.remote(objectKey), rangeHeader);
  }

  /** Copy the selected span of a playback to {@code out}, one slice at a time. */
  public void copy(Playback playback, OutputStream out) throws IOException {
    long position = playback.offset();
    long remaining = playback.length();
    while (remaining > 0) {
      int slice = (int) Math.min(SLICE_BYTES, remaining);
      byte[] bytes = blobStore.readRange(playback.location(), position, slice);
      if (bytes.length == 0) {
        LOGGER.warn(
            "Recording shrank while streaming: location={}, position={}",
            playback.location(),
            position);
        break;
      }
      out.write(bytes);
      position += bytes.length;
      remaining -= bytes.length;
    }
    out.flush();
  }

  private Playback streamOf(RecordingLocation location, String rangeHeader) {
    long size = blobStore.size(location);
    String contentType = AudioFormat.contentTypeFor(location.fileName());
    if (rangeHeader == null || rangeHeader.isBlank()) {
      return Playback.stream(location, contentType, size, null);
    }
    ByteRange range = ByteRange.parse(rangeHeader, size);
    LOGGER.debug("Serving range: location={}, range={}", location, range.contentRange(size));
    return Playback.stream(location, contentType, size, range);
  }
}
