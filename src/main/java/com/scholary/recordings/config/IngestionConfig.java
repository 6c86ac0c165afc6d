package com.scholary.recordings.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recordings.blobstore.BlobStore;
import com.scholary.recordings.job.RetryPolicy;
import com.scholary.recordings.session.FileSystemUploadSessionStore;
import com.scholary.recordings.session.UploadSessionStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the upload session store and the retry policy of the worker pool from "ingestion.*".
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public UploadSessionStore uploadSessionStore(
      IngestionProperties properties, BlobStore blobStore, ObjectMapper objectMapper, Clock clock) {
    return new FileSystemUploadSessionStore(
        Path.of(properties.sessionDir()),
        blobStore,
        objectMapper,
        properties.maxChunkBytes(),
        properties.maxExpectedChunks(),
        clock);
  }

  @Bean
  public RetryPolicy retryPolicy(IngestionProperties properties) {
    return new RetryPolicy(properties.maxAttempts(), properties.backoffBase());
  }

  /** Directory for single-request uploads waiting for their job. */
  @Bean
  public Path uploadTempDir(IngestionProperties properties) throws IOException {
    return Files.createDirectories(Path.of(properties.tempDir()).toAbsolutePath().normalize());
  }
}
