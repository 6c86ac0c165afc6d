package com.scholary.recordings.api;

import com.scholary.recordings.callrecord.CallOutcome;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record LogCallRequest(@NotNull CallOutcome outcome, @PositiveOrZero Integer durationSeconds) {}
