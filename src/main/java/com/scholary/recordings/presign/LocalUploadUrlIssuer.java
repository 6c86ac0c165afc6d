package com.scholary.recordings.presign;

/**
 * Development fallback: hands out URLs on this service's own {@code /api/uploads} endpoint.
 *
 * <p>These URLs are not signed and never expire. Only trusted development clients should ever see
 * them.
 */
public class LocalUploadUrlIssuer implements PresignedUrlIssuer {

  static final String UPLOAD_PATH = "/api/uploads/";

  private final String publicBaseUrl;

  public LocalUploadUrlIssuer(String publicBaseUrl) {
    this.publicBaseUrl =
        publicBaseUrl.endsWith("/")
            ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
            : publicBaseUrl;
  }

  @Override
  public PresignedUrl issueUploadUrl(String objectKey, String contentType) {
    return PresignedUrl.unlimited(publicBaseUrl + UPLOAD_PATH + objectKey);
  }

  @Override
  public PresignedUrl issueDownloadUrl(String objectKey) {
    return PresignedUrl.unlimited(publicBaseUrl + UPLOAD_PATH + objectKey);
  }
}
