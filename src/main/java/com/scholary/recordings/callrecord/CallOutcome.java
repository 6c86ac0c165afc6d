package com.scholary.recordings.callrecord;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Result of a call attempt as reported by the agent. */
public enum CallOutcome {
  CONNECTED,
  NO_ANSWER,
  BUSY,
  INVALID_NUMBER;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CallOutcome fromWireName(String value) {
    if (value == null) {
      return null;
    }
    for (CallOutcome outcome : values()) {
      if (outcome.wireName().equals(value.toLowerCase(Locale.ROOT))) {
        return outcome;
      }
    }
    throw new IllegalArgumentException("Unknown call outcome: " + value);
  }
}
