package com.scholary.recordings.api;

import com.scholary.recordings.callrecord.CallerIdentity;
import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.logging.StructuredLogger;
import com.scholary.recordings.presign.PresignedUrl;
import com.scholary.recordings.service.IngestionAccepted;
import com.scholary.recordings.service.Playback;
import com.scholary.recordings.service.PresignedUpload;
import com.scholary.recordings.service.RecordingIngestionService;
import com.scholary.recordings.service.RecordingStreamingService;
import com.scholary.recordings.session.AppendResult;
import com.scholary.recordings.session.UploadSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST API for recording upload and playback.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Issuing direct upload URLs
 *   <li>Uploading, either in one request or in chunks, and confirming direct uploads
 *   <li>Streaming a recording with HTTP Range support
 * </ul>
 */
@RestController
@RequestMapping("/api/recordings")
@Tag(name = "Recordings", description = "Call recording ingestion and playback")
public class RecordingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingController.class);

  private final RecordingIngestionService ingestionService;
  private final RecordingStreamingService streamingService;

  public RecordingController(
      RecordingIngestionService ingestionService, RecordingStreamingService streamingService) {
    this.ingestionService = ingestionService;
    this.streamingService = streamingService;
  }

  @PostMapping("/presign")
  @Operation(
      summary = "Issue a direct upload URL",
      description =
          "Returns a URL the client PUTs the recording to, and the object key to confirm with"
              + " mode=s3_confirm afterwards. URLs issued by the local backend have no expiry;"
              + " check time_limited.")
  public PresignResponse presign(
      CallerIdentity caller, @Valid @RequestBody PresignRequest request) {
    PresignedUpload upload =
        ingestionService.presign(
            caller, request.callRecordId(), request.contentType(), request.fileName());
    PresignedUrl url = upload.url();
    return new PresignResponse(
        url.url(), upload.objectKey(), upload.contentType(), url.expiresAt(), url.isTimeLimited());
  }

  /** JSON modes: s3_confirm, init, append (base64 bytes) and finalize. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Upload a recording (JSON)",
      description =
          "mode=s3_confirm attaches a direct upload synchronously. mode=init starts a chunked"
              + " upload, mode=append stores one chunk, mode=finalize queues assembly and returns"
              + " 202 immediately.")
  public ResponseEntity<UploadResponse> upload(
      CallerIdentity caller, @RequestBody UploadRequest request) {
    if (request.mode() == null) {
      throw new ValidationException("mode is required");
    }
    try {
      StructuredLogger.setRequestContext(
          request.callRecordId() == null ? null : request.callRecordId().toString(),
          request.sessionId());
      LOGGER.info("Upload request: mode={}, agentId={}", request.mode().wireName(), caller.agentId());

      switch (request.mode()) {
        case S3_CONFIRM:
          ingestionService.confirmRemote(caller, request.callRecordId(), request.objectKey());
          return ResponseEntity.ok(UploadResponse.attached(request.callRecordId()));
        case INIT:
          UploadSession session =
              ingestionService.initSession(
                  caller, request.callRecordId(), request.expectedChunks(), request.fileName());
          return ResponseEntity.status(HttpStatus.CREATED)
              .body(
                  UploadResponse.sessionCreated(
                      session.callRecordId(), session.sessionId(), session.expectedChunks()));
        case APPEND:
          AppendResult result =
              ingestionService.append(
                  caller,
                  request.sessionId(),
                  request.index(),
                  request.bytes(),
                  request.callRecordId());
          return ResponseEntity.status(HttpStatus.ACCEPTED)
              .body(
                  UploadResponse.chunkStored(
                      result.sessionId(), result.chunksReceived(), result.totalSize()));
        case FINALIZE:
          IngestionAccepted accepted =
              ingestionService.finalizeSession(
                  caller, request.sessionId(), request.expectedChunks(), request.callRecordId());
          return ResponseEntity.status(HttpStatus.ACCEPTED)
              .body(UploadResponse.accepted(accepted.callRecordId(), accepted.jobId()));
        case SIMPLE:
          throw new ValidationException("mode=simple requires a multipart/form-data request");
        default:
          throw new ValidationException("Unsupported upload mode: " + request.mode());
      }
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /** Multipart modes: simple (whole file) and append (one chunk as a file part). */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload a recording (multipart)",
      description =
          "mode=simple stores the file and queues attachment, returning 202. mode=append stores"
              + " the file part as chunk 'index' of 'session_id'.")
  public ResponseEntity<UploadResponse> uploadMultipart(
      CallerIdentity caller,
      @RequestParam("mode") String mode,
      @RequestParam(value = "call_record_id", required = false) UUID callRecordId,
      @RequestParam(value = "session_id", required = false) String sessionId,
      @RequestParam(value = "index", required = false) Integer index,
      @RequestPart(value = "file", required = false) MultipartFile file) {
    UploadMode uploadMode = UploadMode.fromWireName(mode);
    try {
      StructuredLogger.setRequestContext(
          callRecordId == null ? null : callRecordId.toString(), sessionId);
      LOGGER.info("Multipart upload request: mode={}, agentId={}", uploadMode.wireName(), caller.agentId());

      switch (uploadMode) {
        case SIMPLE:
          IngestionAccepted accepted = acceptSimple(caller, callRecordId, file);
          return ResponseEntity.status(HttpStatus.ACCEPTED)
              .body(UploadResponse.accepted(accepted.callRecordId(), accepted.jobId()));
        case APPEND:
          AppendResult result =
              ingestionService.append(
                  caller, sessionId, index, file == null ? null : file.getBytes(), callRecordId);
          return ResponseEntity.status(HttpStatus.ACCEPTED)
              .body(
                  UploadResponse.chunkStored(
                      result.sessionId(), result.chunksReceived(), result.totalSize()));
        default:
          throw new ValidationException(
              "mode=" + uploadMode.wireName() + " requires an application/json request");
      }
    } catch (IOException e) {
      throw new TransientStorageException("Failed to read uploaded file", e);
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  @GetMapping("/{callRecordId}")
  @Operation(
      summary = "Play a recording",
      description =
          "Streams a local recording (200, or 206 for a Range request) or redirects (302) to a"
              + " download URL for recordings in object storage. Range supports bytes=a-b,"
              + " bytes=a- and bytes=-n; only the first of several ranges is served. Unsatisfiable"
              + " or malformed ranges get 416.")
  public ResponseEntity<StreamingResponseBody> play(
      CallerIdentity caller,
      @PathVariable UUID callRecordId,
      @RequestHeader(value = HttpHeaders.RANGE, required = false) String range) {
    try {
      StructuredLogger.setRequestContext(callRecordId.toString(), null);
      Playback playback = streamingService.open(caller, callRecordId, range);
      return PlaybackResponses.toResponse(playback, streamingService);
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  private IngestionAccepted acceptSimple(
      CallerIdentity caller, UUID callRecordId, MultipartFile file) throws IOException {
    InputStream content = file == null ? null : file.getInputStream();
    try {
      return ingestionService.acceptSimple(
          caller, callRecordId, content, file == null ? null : file.getOriginalFilename());
    } finally {
      if (content != null) {
        content.close();
      }
    }
  }
}
