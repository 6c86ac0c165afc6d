package com.scholary.recordings.api;

import com.scholary.recordings.blobstore.BlobNames;
import com.scholary.recordings.blobstore.LocalBlobStore;
import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.service.Playback;
import com.scholary.recordings.service.RecordingStreamingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Same-origin stand-in for presigned object storage URLs, active with the local backend only.
 *
 * <p>Neither endpoint checks the caller: possession of an issued key is the only credential, as
 * with a presigned URL, but without expiry. Development use only.
 */
@RestController
@RequestMapping("/api/uploads/recordings")
@ConditionalOnProperty(
    prefix = "storage",
    name = "backend",
    havingValue = "local",
    matchIfMissing = true)
@Tag(name = "Local uploads", description = "Development fallback for direct uploads")
public class LocalUploadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalUploadController.class);

  private final LocalBlobStore blobStore;
  private final RecordingStreamingService streamingService;

  public LocalUploadController(
      LocalBlobStore blobStore, RecordingStreamingService streamingService) {
    this.blobStore = blobStore;
    this.streamingService = streamingService;
  }

  @PutMapping("/{name}")
  @Operation(summary = "Upload to a locally issued URL")
  public ResponseEntity<Void> put(@PathVariable String name, HttpServletRequest request) {
    String objectKey = BlobNames.RECORDINGS_PREFIX + name;
    if (!BlobNames.isIssuedObjectKey(objectKey)) {
      throw new ValidationException("Unknown object key: " + objectKey);
    }
    try (InputStream body = request.getInputStream()) {
      blobStore.putObject(objectKey, body);
    } catch (IOException e) {
      throw new TransientStorageException("Failed to read upload body for " + objectKey, e);
    }
    LOGGER.info("Direct upload stored: key={}", objectKey);
    return ResponseEntity.ok().build();
  }

  @GetMapping("/{name}")
  @Operation(summary = "Download from a locally issued URL", description = "Supports Range.")
  public ResponseEntity<StreamingResponseBody> get(
      @PathVariable String name,
      @RequestHeader(value = HttpHeaders.RANGE, required = false) String range) {
    Playback playback = streamingService.openObject(BlobNames.RECORDINGS_PREFIX + name, range);
    return PlaybackResponses.toResponse(playback, streamingService);
  }
}
