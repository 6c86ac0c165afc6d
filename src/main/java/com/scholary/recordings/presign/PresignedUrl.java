package com.scholary.recordings.presign;

import java.time.Instant;

/**
 * A URL the client can use directly against storage.
 *
 * @param url the URL
 * @param expiresAt when the URL stops working, or {@code null} for same-origin fallback URLs, which
 *     never expire
 */
public record PresignedUrl(String url, Instant expiresAt) {

  public static PresignedUrl unlimited(String url) {
    return new PresignedUrl(url, null);
  }

  /** Whether the URL is time-limited. Locally issued URLs are not. */
  public boolean isTimeLimited() {
    return expiresAt != null;
  }
}
