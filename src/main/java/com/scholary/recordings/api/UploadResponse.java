package com.scholary.recordings.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.UUID;

/** Response of {@code POST /api/recordings}; fields not relevant to the mode are omitted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadResponse(
    String status,
    UUID callRecordId,
    UUID jobId,
    String sessionId,
    Integer expectedChunks,
    Integer chunksReceived,
    Long totalSize) {

  static UploadResponse accepted(UUID callRecordId, UUID jobId) {
    return new UploadResponse("accepted", callRecordId, jobId, null, null, null, null);
  }

  static UploadResponse attached(UUID callRecordId) {
    return new UploadResponse("attached", callRecordId, null, null, null, null, null);
  }

  static UploadResponse sessionCreated(UUID callRecordId, String sessionId, int expectedChunks) {
    return new UploadResponse(
        "initialized", callRecordId, null, sessionId, expectedChunks, null, null);
  }

  static UploadResponse chunkStored(String sessionId, int chunksReceived, long totalSize) {
    return new UploadResponse("received", null, null, sessionId, null, chunksReceived, totalSize);
  }
}
