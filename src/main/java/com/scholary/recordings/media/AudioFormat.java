package com.scholary.recordings.media;

import java.util.Locale;
import java.util.Optional;

/** Audio containers accepted for call recordings, keyed by file extension. */
public enum AudioFormat {
  AAC(".aac", "audio/aac"),
  MP3(".mp3", "audio/mpeg"),
  M4A(".m4a", "audio/mp4"),
  WAV(".wav", "audio/wav"),
  OGG(".ogg", "audio/ogg");

  /** Mobile recorders produce AAC unless told otherwise. */
  public static final AudioFormat DEFAULT = AAC;

  private final String extension;
  private final String contentType;

  AudioFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  public static Optional<AudioFormat> fromFileName(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (AudioFormat format : values()) {
      if (lower.endsWith(format.extension)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  public static Optional<AudioFormat> fromContentType(String contentType) {
    if (contentType == null) {
      return Optional.empty();
    }
    String lower = contentType.toLowerCase(Locale.ROOT).trim();
    for (AudioFormat format : values()) {
      if (lower.equals(format.contentType)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /** Content type served for a stored file, falling back to {@link #DEFAULT}. */
  public static String contentTypeFor(String fileName) {
    return fromFileName(fileName).orElse(DEFAULT).contentType();
  }
}
