package com.scholary.recordings.api;

import com.scholary.recordings.callrecord.CallOutcome;
import com.scholary.recordings.callrecord.CallRecord;
import java.time.Instant;
import java.util.UUID;

/** A call record as returned by the API. The storage location itself is not exposed. */
public record CallRecordResponse(
    UUID id,
    String leadId,
    String agentId,
    CallOutcome outcome,
    Integer durationSeconds,
    boolean hasRecording,
    Instant createdAt) {

  static CallRecordResponse from(CallRecord record) {
    return new CallRecordResponse(
        record.getId(),
        record.getLeadId(),
        record.getAgentId(),
        record.getOutcome(),
        record.getDurationSeconds(),
        record.getRecordingLocation().isPresent(),
        record.getCreatedAt());
  }
}
