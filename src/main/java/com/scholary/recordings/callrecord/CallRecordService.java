package com.scholary.recordings.callrecord;

import com.scholary.recordings.error.AuthorizationException;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.error.ValidationException;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Logs call attempts and resolves call records for the recording endpoints. */
@Service
public class CallRecordService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CallRecordService.class);

  private final CallRecordRepository repository;
  private final RecordingAccessPolicy accessPolicy;
  private final Clock clock;

  public CallRecordService(
      CallRecordRepository repository, RecordingAccessPolicy accessPolicy, Clock clock) {
    this.repository = repository;
    this.accessPolicy = accessPolicy;
    this.clock = clock;
  }

  /**
   * Record a call attempt by the calling agent. The record starts without a recording.
   *
   * @throws ValidationException if the outcome is missing or the duration negative
   */
  @Transactional
  public CallRecord logCall(
      CallerIdentity caller, String leadId, CallOutcome outcome, Integer durationSeconds) {
    if (leadId == null || leadId.isBlank()) {
      throw new ValidationException("lead_id is required");
    }
    if (outcome == null) {
      throw new ValidationException("outcome is required");
    }
    if (durationSeconds != null && durationSeconds < 0) {
      throw new ValidationException("duration_seconds must be >= 0");
    }

    CallRecord record =
        new CallRecord(
            UUID.randomUUID(), leadId, caller.agentId(), outcome, durationSeconds, clock.instant());
    repository.save(record);
    LOGGER.info(
        "Call logged: callRecordId={}, leadId={}, agentId={}, outcome={}",
        record.getId(),
        leadId,
        caller.agentId(),
        outcome);
    return record;
  }

  /**
   * Load a call record the caller is allowed to act on.
   *
   * @throws NotFoundException if the record does not exist
   * @throws AuthorizationException if the caller may not access it
   */
  @Transactional(readOnly = true)
  public CallRecord requireAccessible(CallerIdentity caller, UUID callRecordId) {
    if (callRecordId == null) {
      throw new ValidationException("call_record_id is required");
    }
    CallRecord record =
        repository
            .findById(callRecordId)
            .orElseThrow(() -> new NotFoundException(What.CALL_RECORD, callRecordId.toString()));
    if (!accessPolicy.canAccess(caller, record)) {
      LOGGER.warn(
          "Access denied: agentId={}, callRecordId={}", caller.agentId(), callRecordId);
      throw new AuthorizationException("You are not authorized to access this call record");
    }
    return record;
  }
}
