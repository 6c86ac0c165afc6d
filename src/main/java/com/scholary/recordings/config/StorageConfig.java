package com.scholary.recordings.config;

import com.scholary.recordings.blobstore.BlobStore;
import com.scholary.recordings.blobstore.LocalBlobStore;
import com.scholary.recordings.blobstore.S3BlobStore;
import com.scholary.recordings.presign.LocalUploadUrlIssuer;
import com.scholary.recordings.presign.PresignedUrlIssuer;
import com.scholary.recordings.presign.S3PresignedUrlIssuer;
import java.net.URI;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Selects the storage backend.
 *
 * <p>Exactly one of the nested configurations is active, chosen by {@code storage.backend}. Each
 * contributes a {@link BlobStore} and a {@link PresignedUrlIssuer}; everything downstream depends
 * on those interfaces only.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

  @Configuration
  @ConditionalOnProperty(
      prefix = "storage",
      name = "backend",
      havingValue = "local",
      matchIfMissing = true)
  static class LocalStorageConfig {

    @Bean
    LocalBlobStore blobStore(StorageProperties properties) {
      LOGGER.info("Using local storage backend");
      StorageProperties.Local local = properties.local();
      return new LocalBlobStore(
          Path.of(local.recordingsDir()), Path.of(local.objectDir()), local.maxPathLength());
    }

    @Bean
    PresignedUrlIssuer presignedUrlIssuer(StorageProperties properties) {
      LOGGER.warn(
          "Upload URLs will point at {} and are not time-limited; do not use in production",
          properties.publicBaseUrl());
      return new LocalUploadUrlIssuer(properties.publicBaseUrl());
    }
  }

  @Configuration
  @ConditionalOnProperty(prefix = "storage", name = "backend", havingValue = "s3")
  static class S3StorageConfig {

    @Bean(destroyMethod = "close")
    S3Client s3Client(StorageProperties properties) {
      StorageProperties.S3 s3 = requireS3(properties);
      LOGGER.info(
          "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
          s3.endpoint(),
          s3.bucket(),
          s3.pathStyleAccess());

      var builder =
          S3Client.builder()
              .region(regionOf(s3))
              .credentialsProvider(credentialsOf(s3))
              .forcePathStyle(s3.pathStyleAccess()); // Required for MinIO
      if (hasText(s3.endpoint())) {
        builder.endpointOverride(URI.create(s3.endpoint()));
      }
      return builder.build();
    }

    @Bean(destroyMethod = "close")
    S3Presigner s3Presigner(StorageProperties properties) {
      StorageProperties.S3 s3 = requireS3(properties);
      var builder =
          S3Presigner.builder()
              .region(regionOf(s3))
              .credentialsProvider(credentialsOf(s3))
              .serviceConfiguration(
                  S3Configuration.builder().pathStyleAccessEnabled(s3.pathStyleAccess()).build());
      if (hasText(s3.endpoint())) {
        builder.endpointOverride(URI.create(s3.endpoint()));
      }
      return builder.build();
    }

    @Bean
    S3BlobStore blobStore(S3Client s3Client, StorageProperties properties) {
      LOGGER.info("Using S3 storage backend");
      return new S3BlobStore(s3Client, requireS3(properties).bucket());
    }

    @Bean
    PresignedUrlIssuer presignedUrlIssuer(S3Presigner s3Presigner, StorageProperties properties) {
      return new S3PresignedUrlIssuer(
          s3Presigner, requireS3(properties).bucket(), properties.presignTtl());
    }
  }

  static StorageProperties.S3 requireS3(StorageProperties properties) {
    StorageProperties.S3 s3 = properties.s3();
    if (s3 == null
        || !hasText(s3.bucket())
        || !hasText(s3.accessKey())
        || !hasText(s3.secretKey())) {
      throw new IllegalStateException(
          "storage.s3.bucket, storage.s3.accessKey and storage.s3.secretKey are required when"
              + " storage.backend=s3");
    }
    return s3;
  }

  private static Region regionOf(StorageProperties.S3 s3) {
    return hasText(s3.region()) ? Region.of(s3.region()) : Region.US_EAST_1;
  }

  private static StaticCredentialsProvider credentialsOf(StorageProperties.S3 s3) {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(s3.accessKey(), s3.secretKey()));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
