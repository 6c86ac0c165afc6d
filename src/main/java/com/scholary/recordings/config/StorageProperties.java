package com.scholary.recordings.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Storage configuration, bound once at startup from the "storage.*" keys.
 *
 * <p>{@link StorageConfig} reads this to pick the blob store and URL issuer. Nothing else looks at
 * the environment to decide between local and object storage.
 */
@ConfigurationProperties(prefix = "storage")
@Validated
public record StorageProperties(
    @NotNull StorageBackend backend,
    @NotNull Duration presignTtl,
    @NotBlank String publicBaseUrl,
    @Valid @NotNull Local local,
    @Valid S3 s3) {

  public record Local(
      @NotBlank String recordingsDir, @NotBlank String objectDir, @Positive int maxPathLength) {}

  /** Connection settings for S3 or MinIO. Required when the backend is S3. */
  public record S3(
      String endpoint,
      String accessKey,
      String secretKey,
      String bucket,
      String region,
      boolean pathStyleAccess) {}
}
