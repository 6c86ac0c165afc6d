package com.scholary.recordings.api;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/** Request for a direct upload URL. {@code contentType} and {@code fileName} select the format. */
public record PresignRequest(@NotNull UUID callRecordId, String contentType, String fileName) {}
