package com.scholary.recordings.blobstore;

import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.media.AudioFormat;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Naming rules for stored recordings and for client-uploaded object keys. */
public final class BlobNames {

  /** Prefix of every object key this service issues. */
  public static final String RECORDINGS_PREFIX = "recordings/";

  private static final Pattern SAFE_HINT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
  private static final String UUID_PATTERN =
      "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";
  private static final Pattern ISSUED_KEY =
      Pattern.compile(
          Pattern.quote(RECORDINGS_PREFIX)
              + "("
              + UUID_PATTERN
              + ")_"
              + UUID_PATTERN
              + "(\\.[a-z0-9]{1,5})?");

  private BlobNames() {}

  /**
   * Name for a finished recording: {@code <callRecordId>_<epochSeconds>_<suffix><ext>}.
   *
   * <p>The random suffix keeps two finalizations for the same call record within one second from
   * colliding.
   */
  public static String recordingHint(UUID callRecordId, String originalFileName, Instant now) {
    String extension = AudioFormat.fromFileName(originalFileName).orElse(AudioFormat.DEFAULT).extension();
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    return callRecordId + "_" + now.getEpochSecond() + "_" + suffix + extension;
  }

  /**
   * A fresh object key for a direct client upload: {@code recordings/<callRecordId>_<uuid><ext>}.
   * The call record the key was issued for is recoverable with {@link #issuedFor(String)}.
   */
  public static String newObjectKey(UUID callRecordId, AudioFormat format) {
    return RECORDINGS_PREFIX + callRecordId + "_" + UUID.randomUUID() + format.extension();
  }

  public static boolean isIssuedObjectKey(String key) {
    return key != null && ISSUED_KEY.matcher(key).matches();
  }

  /** The call record an issued key belongs to, or empty if the key was not issued here. */
  public static Optional<UUID> issuedFor(String key) {
    if (key == null) {
      return Optional.empty();
    }
    Matcher matcher = ISSUED_KEY.matcher(key);
    return matcher.matches() ? Optional.of(UUID.fromString(matcher.group(1))) : Optional.empty();
  }

  /**
   * Reject hints that could escape the storage root.
   *
   * @throws ValidationException if the hint is blank, contains a separator or {@code ..}
   */
  public static String requireSafeHint(String hint) {
    if (hint == null || hint.isBlank()) {
      throw new ValidationException("Blob name must not be blank");
    }
    if (hint.contains("..") || hint.indexOf('\0') >= 0 || !SAFE_HINT.matcher(hint).matches()) {
      throw new ValidationException("Blob name contains illegal characters: " + hint);
    }
    return hint;
  }
}
