package com.scholary.recordings.callrecord;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Spring Data JPA repository for {@link CallRecord}. */
@Repository
public interface CallRecordRepository extends JpaRepository<CallRecord, UUID> {

  /**
   * Set the recording location only if none is set yet.
   *
   * @return 1 if the location was written, 0 if the record is missing or already has one
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "update CallRecord c set c.recordingLocation = :location"
          + " where c.id = :id and c.recordingLocation is null")
  int attachIfAbsent(@Param("id") UUID id, @Param("location") String location);
}
