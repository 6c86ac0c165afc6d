package com.scholary.recordings.session;

/** Progress of a chunked upload after an append. */
public record AppendResult(String sessionId, int chunksReceived, long totalSize) {}
