package com.scholary.recordings.location;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a stored recording lives: a file on the local filesystem or an object key in the object
 * store.
 *
 * <p>Persisted as a single string. Local locations are stored as the plain absolute path, remote
 * locations carry the {@code remote:} marker. Rows written before the marker was introduced use
 * {@code s3:}, which is still accepted when parsing.
 */
public record RecordingLocation(Kind kind, String value) {

  public static final String REMOTE_PREFIX = "remote:";
  static final String LEGACY_REMOTE_PREFIX = "s3:";

  public enum Kind {
    LOCAL,
    REMOTE
  }

  public RecordingLocation {
    Objects.requireNonNull(kind, "kind");
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("recording location value must not be blank");
    }
  }

  public static RecordingLocation local(Path path) {
    return new RecordingLocation(Kind.LOCAL, path.toAbsolutePath().normalize().toString());
  }

  public static RecordingLocation remote(String objectKey) {
    return new RecordingLocation(Kind.REMOTE, objectKey);
  }

  /**
   * Parse the persisted form.
   *
   * @param encoded the stored string
   * @return the location
   * @throws IllegalArgumentException if the string is blank
   */
  public static RecordingLocation parse(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      throw new IllegalArgumentException("encoded recording location must not be blank");
    }
    if (encoded.startsWith(REMOTE_PREFIX)) {
      return remote(encoded.substring(REMOTE_PREFIX.length()));
    }
    if (encoded.startsWith(LEGACY_REMOTE_PREFIX)) {
      return remote(encoded.substring(LEGACY_REMOTE_PREFIX.length()));
    }
    return new RecordingLocation(Kind.LOCAL, encoded);
  }

  public String encode() {
    return isRemote() ? REMOTE_PREFIX + value : value;
  }

  public boolean isRemote() {
    return kind == Kind.REMOTE;
  }

  /** The filesystem path of a local location. */
  public Path path() {
    if (isRemote()) {
      throw new IllegalStateException("remote location has no local path: " + value);
    }
    return Path.of(value);
  }

  /** The object key of a remote location. */
  public String objectKey() {
    if (!isRemote()) {
      throw new IllegalStateException("local location has no object key: " + value);
    }
    return value;
  }

  /** Last path segment, used for content type detection. */
  public String fileName() {
    int slash = Math.max(value.lastIndexOf('/'), value.lastIndexOf('\\'));
    return slash >= 0 ? value.substring(slash + 1) : value;
  }

  @Override
  public String toString() {
    return encode();
  }
}
