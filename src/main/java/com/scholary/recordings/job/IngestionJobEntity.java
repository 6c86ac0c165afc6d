package com.scholary.recordings.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable row of the ingestion job queue.
 *
 * <p>The job itself is stored as JSON in {@code payload}; the remaining columns track its
 * execution.
 */
@Entity
@Table(
    name = "ingestion_jobs",
    indexes = {
      @Index(name = "idx_ingestion_jobs_due", columnList = "status, nextAttemptAt"),
      @Index(name = "idx_ingestion_jobs_dedupe", columnList = "dedupeKey")
    })
public class IngestionJobEntity {

  private static final int MAX_ERROR_LENGTH = 2000;

  @Id private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  private JobType type;

  @Column(nullable = false, length = 4000)
  private String payload;

  @Column(nullable = false)
  private UUID callRecordId;

  /** Upload session id for chunked jobs, used to fold duplicate finalize requests. */
  @Column private String dedupeKey;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  private JobStatus status;

  @Column(nullable = false)
  private int attempts;

  @Column(nullable = false)
  private Instant nextAttemptAt;

  @Column(length = MAX_ERROR_LENGTH)
  private String lastError;

  @Enumerated(EnumType.STRING)
  @Column(length = 32)
  private CancelReason cancelReason;

  @Column(length = 500)
  private String stagedLocation;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  protected IngestionJobEntity() {}

  public IngestionJobEntity(
      UUID id, JobType type, String payload, UUID callRecordId, String dedupeKey, Instant now) {
    this.id = id;
    this.type = type;
    this.payload = payload;
    this.callRecordId = callRecordId;
    this.dedupeKey = dedupeKey;
    this.status = JobStatus.PENDING;
    this.attempts = 0;
    this.nextAttemptAt = now;
    this.createdAt = now;
    this.updatedAt = now;
  }

  void complete(Instant now) {
    this.status = JobStatus.COMPLETED;
    this.lastError = null;
    this.updatedAt = now;
  }

  void cancel(CancelReason reason, Instant now) {
    this.status = JobStatus.CANCELLED;
    this.cancelReason = reason;
    this.updatedAt = now;
  }

  void scheduleRetry(String error, Instant nextAttemptAt, Instant now) {
    this.status = JobStatus.PENDING;
    this.lastError = truncate(error);
    this.nextAttemptAt = nextAttemptAt;
    this.updatedAt = now;
  }

  void fail(String error, Instant now) {
    this.status = JobStatus.FAILED;
    this.lastError = truncate(error);
    this.updatedAt = now;
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }

  public UUID getId() {
    return id;
  }

  public JobType getType() {
    return type;
  }

  public String getPayload() {
    return payload;
  }

  public UUID getCallRecordId() {
    return callRecordId;
  }

  public String getDedupeKey() {
    return dedupeKey;
  }

  public JobStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public String getLastError() {
    return lastError;
  }

  public CancelReason getCancelReason() {
    return cancelReason;
  }

  public String getStagedLocation() {
    return stagedLocation;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
