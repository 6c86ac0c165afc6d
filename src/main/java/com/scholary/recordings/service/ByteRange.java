package com.scholary.recordings.service;

import com.scholary.recordings.error.RangeNotSatisfiableException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An inclusive byte span of a blob, resolved from an HTTP {@code Range} header.
 *
 * <p>Supported forms are {@code bytes=a-b}, {@code bytes=a-} and the suffix form {@code bytes=-n}.
 * When the header lists several ranges only the first is served. Anything that does not parse, and
 * any range starting at or past the end of the blob, is unsatisfiable.
 */
public record ByteRange(long start, long end) {

  private static final Pattern FIRST_RANGE =
      Pattern.compile("^\\s*bytes\\s*=\\s*(\\d*)\\s*-\\s*(\\d*)\\s*(?:,.*)?$", Pattern.CASE_INSENSITIVE);

  public long length() {
    return end - start + 1;
  }

  /** Value of the {@code Content-Range} response header. */
  public String contentRange(long size) {
    return "bytes " + start + "-" + end + "/" + size;
  }

  /**
   * Resolve a {@code Range} header against a blob.
   *
   * @param header the header value, not null
   * @param size size of the blob in bytes
   * @throws RangeNotSatisfiableException if the header is malformed or outside the blob
   */
  public static ByteRange parse(String header, long size) {
    Matcher matcher = FIRST_RANGE.matcher(header);
    if (!matcher.matches() || size <= 0) {
      throw new RangeNotSatisfiableException(header, size);
    }
    String first = matcher.group(1);
    String last = matcher.group(2);

    try {
      if (first.isEmpty()) {
        if (last.isEmpty()) {
          throw new RangeNotSatisfiableException(header, size);
        }
        long suffix = Long.parseLong(last);
        if (suffix == 0) {
          throw new RangeNotSatisfiableException(header, size);
        }
        return new ByteRange(Math.max(0, size - suffix), size - 1);
      }

      long start = Long.parseLong(first);
      if (start >= size) {
        throw new RangeNotSatisfiableException(header, size);
      }
      long end = last.isEmpty() ? size - 1 : Long.parseLong(last);
      if (end < start) {
        throw new RangeNotSatisfiableException(header, size);
      }
      return new ByteRange(start, Math.min(end, size - 1));
    } catch (NumberFormatException e) {
      // Digits too long for a long
      throw new RangeNotSatisfiableException(header, size);
    }
  }
}
