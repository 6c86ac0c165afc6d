package com.scholary.recordings.api;

import java.util.UUID;

/**
 * JSON body of {@code POST /api/recordings}. Which fields are required depends on {@link #mode}.
 *
 * @param bytes chunk content for {@code append}, base64 in JSON
 */
public record UploadRequest(
    UploadMode mode,
    UUID callRecordId,
    String objectKey,
    Integer expectedChunks,
    String fileName,
    String sessionId,
    Integer index,
    byte[] bytes) {}
