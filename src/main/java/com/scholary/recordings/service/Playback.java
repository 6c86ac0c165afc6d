package com.scholary.recordings.service;

import com.scholary.recordings.location.RecordingLocation;

/**
 * How to answer a playback request: either redirect to storage, or stream bytes of a local blob.
 *
 * @param redirectUrl set for redirects only
 * @param range the span to send, or {@code null} for the whole blob
 */
public record Playback(
    String redirectUrl,
    RecordingLocation location,
    String contentType,
    long size,
    ByteRange range) {

  static Playback redirect(String url) {
    return new Playback(url, null, null, 0, null);
  }

  static Playback stream(RecordingLocation location, String contentType, long size, ByteRange range) {
    return new Playback(null, location, contentType, size, range);
  }

  public boolean isRedirect() {
    return redirectUrl != null;
  }

  public boolean isPartial() {
    return range != null;
  }

  /** First byte to send. */
  public long offset() {
    return range == null ? 0 : range.start();
  }

  /** Number of bytes to send. */
  public long length() {
    return range == null ? size : range.length();
  }
}
