package com.scholary.recordings.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.scholary.recordings.error.ValidationException;
import java.util.Locale;

/** Discriminator of {@code POST /api/recordings} requests. */
public enum UploadMode {
  SIMPLE,
  S3_CONFIRM,
  INIT,
  APPEND,
  FINALIZE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static UploadMode fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("mode is required");
    }
    for (UploadMode mode : values()) {
      if (mode.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return mode;
      }
    }
    throw new ValidationException("Unknown upload mode: " + value);
  }
}
