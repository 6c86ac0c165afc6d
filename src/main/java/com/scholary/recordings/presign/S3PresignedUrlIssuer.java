package com.scholary.recordings.presign;

import com.scholary.recordings.error.TransientStorageException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedPutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/** Presigns S3 GET and PUT requests with a fixed time-to-live. */
public class S3PresignedUrlIssuer implements PresignedUrlIssuer {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3PresignedUrlIssuer.class);

  private final S3Presigner s3Presigner;
  private final String bucket;
  private final Duration ttl;

  public S3PresignedUrlIssuer(S3Presigner s3Presigner, String bucket, Duration ttl) {
    this.s3Presigner = s3Presigner;
    this.bucket = bucket;
    this.ttl = ttl;
  }

  @Override
  public PresignedUrl issueUploadUrl(String objectKey, String contentType) {
    LOGGER.debug("Presigning upload: bucket={}, key={}, ttl={}", bucket, objectKey, ttl);
    try {
      PutObjectRequest putObjectRequest =
          PutObjectRequest.builder().bucket(bucket).key(objectKey).contentType(contentType).build();

      PutObjectPresignRequest presignRequest =
          PutObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .putObjectRequest(putObjectRequest)
              .build();

      PresignedPutObjectRequest presigned = s3Presigner.presignPutObject(presignRequest);
      LOGGER.info("Generated presigned upload URL: bucket={}, key={}", bucket, objectKey);
      return new PresignedUrl(presigned.url().toString(), presigned.expiration());

    } catch (SdkException e) {
      String message =
          String.format("Failed to generate upload URL: bucket=%s, key=%s", bucket, objectKey);
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);
    }
  }

  @Override
  public PresignedUrl issueDownloadUrl(String objectKey) {
    LOGGER.debug("Presigning download: bucket={}, key={}, ttl={}", bucket, objectKey, ttl);
    try {
      GetObjectRequest getObjectRequest =
          GetObjectRequest.builder().bucket(bucket).key(objectKey).build();

      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .getObjectRequest(getObjectRequest)
              .build();

      PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
      LOGGER.info("Generated presigned download URL: bucket={}, key={}", bucket, objectKey);
      return new PresignedUrl(presigned.url().toString(), presigned.expiration());

    } catch (SdkException e) {
      String message =
          String.format("Failed to generate playback URL: bucket=%s, key=%s", bucket, objectKey);
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);
    }
  }
}
