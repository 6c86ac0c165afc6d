package com.scholary.recordings.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Why a job ended without a recording. Cancelled jobs are never retried. */
public enum CancelReason {
  INCOMPLETE_UPLOAD,
  UPLOAD_NOT_FOUND,
  CALL_RECORD_NOT_FOUND;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
