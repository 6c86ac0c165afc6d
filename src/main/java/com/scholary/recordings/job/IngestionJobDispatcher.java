package com.scholary.recordings.job;

import com.scholary.recordings.config.IngestionProperties;
import com.scholary.recordings.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Feeds due jobs from the {@link IngestionJobQueue} to the finalization pool and records their
 * outcome.
 *
 * <p>At most {@code ingestion.worker-threads} jobs run at once. Jobs of different call records run
 * independently; a slow job only holds its own worker.
 */
@Component
public class IngestionJobDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionJobDispatcher.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final IngestionJobQueue queue;
  private final FinalizationWorker worker;
  private final RetryPolicy retryPolicy;
  private final Executor executor;
  private final IngestionProperties properties;
  private final Clock clock;

  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  public IngestionJobDispatcher(
      IngestionJobQueue queue,
      FinalizationWorker worker,
      RetryPolicy retryPolicy,
      @Qualifier("finalizationExecutor") Executor executor,
      IngestionProperties properties,
      Clock clock) {
    this.queue = queue;
    this.worker = worker;
    this.retryPolicy = retryPolicy;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${ingestion.poll-interval:PT1S}")
  public void poll() {
    int capacity = properties.workerThreads() - inFlight.size();
    if (capacity <= 0) {
      return;
    }

    List<ClaimedJob> claimed = queue.claimDue(capacity);
    for (ClaimedJob job : claimed) {
      inFlight.add(job.jobId());
      try {
        executor.execute(() -> run(job));
      } catch (RejectedExecutionException e) {
        inFlight.remove(job.jobId());
        LOGGER.warn("Finalization pool rejected job, requeueing: jobId={}", job.jobId());
        queue.release(job.jobId(), "Finalization pool saturated");
      }
    }
  }

  @Scheduled(fixedDelayString = "${ingestion.lease-check-interval:PT30S}")
  public void recoverStaleJobs() {
    Instant cutoff = clock.instant().minus(properties.leaseTimeout());
    int recovered = queue.recoverStale(cutoff, Set.copyOf(inFlight), retryPolicy.maxAttempts());
    if (recovered > 0) {
      LOGGER.warn("Recovered {} ingestion jobs with expired leases", recovered);
    }
  }

  /** Run one claimed job on the calling thread and record its outcome. */
  void run(ClaimedJob job) {
    String jobId = job.jobId().toString();
    StructuredLogger.setJobContext(jobId, job.job().callRecordId().toString());
    try {
      LOGGER.info(
          "Running ingestion job: jobId={}, type={}, attempt={}/{}",
          jobId,
          job.job().type(),
          job.attempt(),
          retryPolicy.maxAttempts());
      JobOutcome outcome = worker.process(job.job(), queue.checkpoint(job));
      if (outcome.isCancelled()) {
        queue.markCancelled(job.jobId(), outcome.cancelReason());
        structuredLogger.logJobCancelled(jobId, outcome.cancelReason().wireName());
      } else {
        queue.markCompleted(job.jobId());
        LOGGER.info("Ingestion job completed: jobId={}", jobId);
      }
    } catch (RuntimeException e) {
      recordFailure(job, e);
    } finally {
      inFlight.remove(job.jobId());
      StructuredLogger.clearJobContext();
    }
  }

  private void recordFailure(ClaimedJob job, RuntimeException failure) {
    String jobId = job.jobId().toString();
    String errorType = failure.getClass().getSimpleName();
    String message = String.valueOf(failure.getMessage());
    try {
      if (retryPolicy.canRetry(job.attempt())) {
        Duration backoff = retryPolicy.backoff(job.attempt());
        queue.scheduleRetry(job.jobId(), errorType + ": " + message, clock.instant().plus(backoff));
        structuredLogger.logJobRetry(
            jobId, job.attempt(), retryPolicy.maxAttempts(), backoff.toMillis(), errorType, message);
      } else {
        queue.markFailed(job.jobId(), errorType + ": " + message);
        structuredLogger.logJobFailed(jobId, job.attempt(), errorType, message);
        LOGGER.error("Ingestion job gave up: jobId={}", jobId, failure);
      }
    } catch (RuntimeException e) {
      // The row stays RUNNING; lease recovery picks it up.
      LOGGER.error("Failed to record failure of ingestion job: jobId={}", jobId, e);
    }
  }

  int inFlightCount() {
    return inFlight.size();
  }
}
