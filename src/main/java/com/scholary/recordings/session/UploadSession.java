package com.scholary.recordings.session;

import java.time.Instant;
import java.util.UUID;

/**
 * Metadata of a chunked upload in progress. Persisted next to the chunks so it survives a restart.
 *
 * @param sessionId opaque id handed to the client
 * @param callRecordId the call record the recording belongs to
 * @param fileName the client's original file name, used for the extension of the final blob
 * @param expectedChunks number of chunks the client declared at init
 * @param createdAt when the session was created
 */
public record UploadSession(
    String sessionId, UUID callRecordId, String fileName, int expectedChunks, Instant createdAt) {}
