package com.scholary.recordings.callrecord;

import com.scholary.recordings.location.RecordingLocation;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * One logged call attempt.
 *
 * <p>Created without a recording. The recording location is set once, by {@link
 * CallRecordRepository#attachIfAbsent}, and never overwritten; there is deliberately no setter.
 */
@Entity
@Table(
    name = "call_records",
    indexes = {@Index(name = "idx_call_records_lead", columnList = "leadId")})
public class CallRecord {

  /** Width of the persisted recording location; also the local path length limit. */
  public static final int MAX_LOCATION_LENGTH = 500;

  @Id private UUID id;

  @Column(nullable = false)
  private String leadId;

  @Column(nullable = false)
  private String agentId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private CallOutcome outcome;

  @Column private Integer durationSeconds;

  @Column(length = MAX_LOCATION_LENGTH)
  private String recordingLocation;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  protected CallRecord() {}

  public CallRecord(
      UUID id,
      String leadId,
      String agentId,
      CallOutcome outcome,
      Integer durationSeconds,
      Instant createdAt) {
    this.id = id;
    this.leadId = leadId;
    this.agentId = agentId;
    this.outcome = outcome;
    this.durationSeconds = durationSeconds;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getLeadId() {
    return leadId;
  }

  public String getAgentId() {
    return agentId;
  }

  public CallOutcome getOutcome() {
    return outcome;
  }

  public Integer getDurationSeconds() {
    return durationSeconds;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Optional<RecordingLocation> getRecordingLocation() {
    return Optional.ofNullable(recordingLocation).map(RecordingLocation::parse);
  }
}
