package com.scholary.recordings.presign;

/**
 * Issues URLs that let a client upload or download a recording without routing the bytes through
 * this service.
 *
 * <p>With object storage the URLs are presigned and expire after {@code storage.presignTtl}. With
 * the local backend they point at this service's own upload endpoint and carry no expiry; callers
 * must check {@link PresignedUrl#isTimeLimited()} rather than assume one.
 */
public interface PresignedUrlIssuer {

  /**
   * @param objectKey key the client will upload to
   * @param contentType content type the client will send
   */
  PresignedUrl issueUploadUrl(String objectKey, String contentType);

  PresignedUrl issueDownloadUrl(String objectKey);
}
