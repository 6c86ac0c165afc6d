package com.scholary.recordings.service;

import java.util.UUID;

/** An upload handed to the finalization worker; the recording is attached later. */
public record IngestionAccepted(UUID callRecordId, UUID jobId) {}
