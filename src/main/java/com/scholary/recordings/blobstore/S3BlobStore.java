package com.scholary.recordings.blobstore;

import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.location.RecordingLocation;
import com.scholary.recordings.media.AudioFormat;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of {@link BlobStore}.
 *
 * <p>Uses AWS SDK v2, which works against real S3 and S3-compatible services. Recordings are stored
 * under the {@code recordings/} prefix and addressed as {@code remote:} locations. The SDK retries
 * throttling and 5xx responses itself; what still fails is reported as {@link
 * TransientStorageException} so the finalization worker can retry the whole step.
 *
 * <p>Local locations are not readable here. Switching a deployment from the local backend to S3
 * does not migrate recordings already on disk.
 */
public class S3BlobStore implements BlobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3BlobStore.class);

  private static final int RANGE_NOT_SATISFIABLE = 416;
  private static final int NOT_FOUND = 404;

  private final S3Client s3Client;
  private final String bucket;

  public S3BlobStore(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    LOGGER.info("Initialized S3 blob store: bucket={}", bucket);
  }

  @Override
  public RecordingLocation put(InputStream data, long contentLength, String hint) {
    String key = BlobNames.RECORDINGS_PREFIX + BlobNames.requireSafeHint(hint);
    LOGGER.debug("Uploading object: bucket={}, key={}, contentLength={}", bucket, key, contentLength);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(AudioFormat.contentTypeFor(hint))
              .contentLength(contentLength)
              .build();

      // PutObject returns only after S3 has persisted the object
      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);
      return RecordingLocation.remote(key);

    } catch (SdkException e) {
      String message = String.format("Failed to upload object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);
    }
  }

  @Override
  public byte[] readRange(RecordingLocation location, long offset, int length) {
    if (offset < 0 || length < 0) {
      throw new IllegalArgumentException("offset and length must be >= 0");
    }
    if (length == 0) {
      return new byte[0];
    }
    String key = keyOf(location);
    long endByte = offset + length - 1;
    LOGGER.debug("Fetching byte range: bucket={}, key={}, range={}-{}", bucket, key, offset, endByte);

    try {
      GetObjectRequest request =
          GetObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .range(String.format("bytes=%d-%d", offset, endByte))
              .build();
      return s3Client.getObjectAsBytes(request).asByteArray();

    } catch (NoSuchKeyException e) {
      throw new NotFoundException(What.BLOB, location.encode(), e);

    } catch (S3Exception e) {
      if (e.statusCode() == RANGE_NOT_SATISFIABLE) {
        // Offset at or past the end of the object
        return new byte[0];
      }
      if (e.statusCode() == NOT_FOUND) {
        throw new NotFoundException(What.BLOB, location.encode(), e);
      }
      String message =
          String.format(
              "Failed to retrieve byte range: bucket=%s, key=%s, range=%d-%d, statusCode=%s",
              bucket, key, offset, endByte, e.statusCode());
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);

    } catch (SdkException e) {
      String message =
          String.format("Unexpected error retrieving byte range: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);
    }
  }

  @Override
  public long size(RecordingLocation location) {
    HeadObjectResponse head = head(location);
    if (head == null) {
      throw new NotFoundException(What.BLOB, location.encode());
    }
    return head.contentLength();
  }

  @Override
  public boolean exists(RecordingLocation location) {
    return head(location) != null;
  }

  @Override
  public boolean delete(RecordingLocation location) {
    if (!exists(location)) {
      LOGGER.debug("Nothing to delete: {}", location);
      return false;
    }
    String key = keyOf(location);
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, key);
      return true;
    } catch (SdkException e) {
      String message = String.format("Failed to delete object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);
    }
  }

  /** Object metadata, or {@code null} when the object does not exist. */
  private HeadObjectResponse head(RecordingLocation location) {
    String key = keyOf(location);
    try {
      return s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (NoSuchKeyException e) {
      return null;
    } catch (S3Exception e) {
      if (e.statusCode() == NOT_FOUND) {
        return null;
      }
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);
    } catch (SdkException e) {
      String message = String.format("Unexpected error getting metadata: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new TransientStorageException(message, e);
    }
  }

  private String keyOf(RecordingLocation location) {
    if (!location.isRemote()) {
      LOGGER.warn("Local recording requested from the S3 backend: {}", location);
      throw new NotFoundException(What.BLOB, location.encode());
    }
    return location.objectKey();
  }
}
