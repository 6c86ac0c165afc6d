package com.scholary.recordings.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for upload sessions and the finalization worker pool.
 *
 * <p>Maps to the "ingestion.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "ingestion")
@Validated
public record IngestionProperties(
    @NotBlank String sessionDir,
    @NotBlank String tempDir,
    @Positive int maxChunkBytes,
    @Positive int maxExpectedChunks,
    @Positive int workerThreads,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration leaseTimeout,
    @NotNull Duration sessionIdleTimeout) {}
