package com.scholary.recordings.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Spring Data JPA repository for {@link IngestionJobEntity}. */
@Repository
public interface IngestionJobRepository extends JpaRepository<IngestionJobEntity, UUID> {

  List<IngestionJobEntity> findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
      JobStatus status, Instant now, Pageable page);

  List<IngestionJobEntity> findByStatusAndUpdatedAtBefore(JobStatus status, Instant cutoff);

  Optional<IngestionJobEntity> findFirstByDedupeKeyAndStatusIn(
      String dedupeKey, Collection<JobStatus> statuses);

  /**
   * Move a pending job to running and count the attempt.
   *
   * @return 1 if this caller claimed the job, 0 if someone else did first
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "update IngestionJobEntity j set j.status = :running, j.attempts = j.attempts + 1,"
          + " j.updatedAt = :now where j.id = :id and j.status = :pending")
  int claim(
      @Param("id") UUID id,
      @Param("now") Instant now,
      @Param("pending") JobStatus pending,
      @Param("running") JobStatus running);

  /** Hand back a claim that never ran, returning the attempt it counted. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "update IngestionJobEntity j set j.status = :pending, j.attempts = j.attempts - 1,"
          + " j.nextAttemptAt = :now, j.updatedAt = :now, j.lastError = :reason"
          + " where j.id = :id and j.status = :running")
  int unclaim(
      @Param("id") UUID id,
      @Param("now") Instant now,
      @Param("reason") String reason,
      @Param("pending") JobStatus pending,
      @Param("running") JobStatus running);

  /** Return a running job whose lease expired to the pending state. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "update IngestionJobEntity j set j.status = :pending, j.nextAttemptAt = :now,"
          + " j.updatedAt = :now, j.lastError = :reason"
          + " where j.id = :id and j.status = :running and j.updatedAt < :cutoff")
  int releaseStale(
      @Param("id") UUID id,
      @Param("now") Instant now,
      @Param("cutoff") Instant cutoff,
      @Param("reason") String reason,
      @Param("pending") JobStatus pending,
      @Param("running") JobStatus running);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update IngestionJobEntity j set j.stagedLocation = :location where j.id = :id")
  int stage(@Param("id") UUID id, @Param("location") String location);
}
