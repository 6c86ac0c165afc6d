package com.scholary.recordings.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recordings.location.RecordingLocation;
import com.scholary.recordings.logging.StructuredLogger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable queue of ingestion jobs, backed by the {@code ingestion_jobs} table.
 *
 * <p>Enqueueing commits a row before returning, so an accepted upload survives a crash. Claiming
 * is a conditional update; two dispatchers polling the same table never run the same job at once.
 */
@Service
public class IngestionJobQueue {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionJobQueue.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Set<JobStatus> ACTIVE = EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING);

  private final IngestionJobRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public IngestionJobQueue(
      IngestionJobRepository repository, ObjectMapper objectMapper, Clock clock) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Persist a job for the worker pool.
   *
   * <p>A chunked job for a session that already has an active job is folded into that job; the
   * existing id is returned.
   *
   * @return the job id
   */
  @Transactional
  public UUID enqueue(IngestionJob job) {
    String dedupeKey = job instanceof ChunkedJob ? ((ChunkedJob) job).sessionId() : null;
    if (dedupeKey != null) {
      Optional<IngestionJobEntity> active = repository.findFirstByDedupeKeyAndStatusIn(dedupeKey, ACTIVE);
      if (active.isPresent()) {
        LOGGER.info(
            "Finalize already queued for session: sessionId={}, jobId={}",
            dedupeKey,
            active.get().getId());
        return active.get().getId();
      }
    }

    IngestionJobEntity entity =
        new IngestionJobEntity(
            UUID.randomUUID(),
            job.type(),
            serialize(job),
            job.callRecordId(),
            dedupeKey,
            clock.instant());
    repository.save(entity);
    structuredLogger.logJobEnqueued(
        entity.getId().toString(), job.type().name(), job.callRecordId().toString());
    return entity.getId();
  }

  /**
   * Claim up to {@code limit} jobs that are due.
   *
   * @return the jobs this caller now owns
   */
  @Transactional
  public List<ClaimedJob> claimDue(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    Instant now = clock.instant();
    List<IngestionJobEntity> due =
        repository.findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
            JobStatus.PENDING, now, PageRequest.of(0, limit));

    List<ClaimedJob> claimed = new ArrayList<>();
    for (IngestionJobEntity candidate : due) {
      if (repository.claim(candidate.getId(), now, JobStatus.PENDING, JobStatus.RUNNING) != 1) {
        continue;
      }
      IngestionJobEntity entity = repository.findById(candidate.getId()).orElseThrow();
      RecordingLocation staged =
          entity.getStagedLocation() == null
              ? null
              : RecordingLocation.parse(entity.getStagedLocation());
      claimed.add(
          new ClaimedJob(entity.getId(), deserialize(entity), entity.getAttempts(), staged));
    }
    return claimed;
  }

  @Transactional
  public void markCompleted(UUID jobId) {
    IngestionJobEntity entity = load(jobId);
    entity.complete(clock.instant());
    repository.save(entity);
  }

  @Transactional
  public void markCancelled(UUID jobId, CancelReason reason) {
    IngestionJobEntity entity = load(jobId);
    entity.cancel(reason, clock.instant());
    repository.save(entity);
  }

  @Transactional
  public void scheduleRetry(UUID jobId, String error, Instant nextAttemptAt) {
    IngestionJobEntity entity = load(jobId);
    entity.scheduleRetry(error, nextAttemptAt, clock.instant());
    repository.save(entity);
  }

  /**
   * Return a claimed job that was never started to the queue. The claim's attempt is not counted
   * against the retry budget.
   */
  @Transactional
  public void release(UUID jobId, String reason) {
    if (repository.unclaim(jobId, clock.instant(), reason, JobStatus.PENDING, JobStatus.RUNNING)
        != 1) {
      LOGGER.warn("Release of ingestion job skipped, no longer running: jobId={}", jobId);
    }
  }

  @Transactional
  public void markFailed(UUID jobId, String error) {
    IngestionJobEntity entity = load(jobId);
    entity.fail(error, clock.instant());
    repository.save(entity);
  }

  /** Checkpoint backed by the job row. */
  public JobCheckpoint checkpoint(ClaimedJob claimed) {
    return new JobCheckpoint() {
      private RecordingLocation staged = claimed.stagedLocation();

      @Override
      public Optional<RecordingLocation> stagedLocation() {
        return Optional.ofNullable(staged);
      }

      @Override
      public void stage(RecordingLocation location) {
        stageLocation(claimed.jobId(), location);
        staged = location;
      }
    };
  }

  @Transactional
  public void stageLocation(UUID jobId, RecordingLocation location) {
    repository.stage(jobId, location.encode());
  }

  /**
   * Release running jobs whose lease expired, typically because the process running them died.
   *
   * @param cutoff jobs last updated before this are stale
   * @param inFlight jobs this process is still running; never released
   * @param maxAttempts jobs that already used this many attempts are failed instead
   * @return number of jobs released or failed
   */
  @Transactional
  public int recoverStale(Instant cutoff, Set<UUID> inFlight, int maxAttempts) {
    int recovered = 0;
    Instant now = clock.instant();
    for (IngestionJobEntity entity :
        repository.findByStatusAndUpdatedAtBefore(JobStatus.RUNNING, cutoff)) {
      if (inFlight.contains(entity.getId())) {
        continue;
      }
      if (entity.getAttempts() >= maxAttempts) {
        entity.fail("Worker lease expired on final attempt", now);
        repository.save(entity);
        structuredLogger.logJobFailed(
            entity.getId().toString(), entity.getAttempts(), "LeaseExpired", "worker lease expired");
      } else {
        repository.releaseStale(
            entity.getId(),
            now,
            cutoff,
            "Worker lease expired",
            JobStatus.PENDING,
            JobStatus.RUNNING);
        LOGGER.warn(
            "Released stale ingestion job: jobId={}, attempts={}",
            entity.getId(),
            entity.getAttempts());
      }
      recovered++;
    }
    return recovered;
  }

  @Transactional(readOnly = true)
  public Optional<IngestionJobEntity> find(UUID jobId) {
    return repository.findById(jobId);
  }

  private IngestionJobEntity load(UUID jobId) {
    return repository
        .findById(jobId)
        .orElseThrow(() -> new IllegalStateException("Ingestion job disappeared: " + jobId));
  }

  private String serialize(IngestionJob job) {
    try {
      return objectMapper.writeValueAsString(job);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize ingestion job", e);
    }
  }

  private IngestionJob deserialize(IngestionJobEntity entity) {
    try {
      return objectMapper.readValue(entity.getPayload(), entity.getType().payloadType());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt payload for ingestion job " + entity.getId(), e);
    }
  }
}
