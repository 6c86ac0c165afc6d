package com.scholary.recordings.api;

import java.time.Instant;

/**
 * A direct upload URL.
 *
 * @param expiresAt {@code null} when the URL is a same-origin fallback that never expires
 * @param timeLimited whether {@code expiresAt} applies
 */
public record PresignResponse(
    String uploadUrl, String objectKey, String contentType, Instant expiresAt, boolean timeLimited) {}
