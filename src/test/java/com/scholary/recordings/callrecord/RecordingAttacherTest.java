package com.scholary.recordings.callrecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.recordings.error.ConflictException;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.location.RecordingLocation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Runs without a test transaction so concurrent attaches commit independently. */
@DataJpaTest
@Import(RecordingAttacher.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class RecordingAttacherTest {

  @Autowired private RecordingAttacher attacher;
  @Autowired private CallRecordRepository repository;

  @AfterEach
  void cleanUp() {
    repository.deleteAll();
  }

  @Test
  void attach_shouldSetLocationOnce() {
    CallRecord record = saveRecord();
    RecordingLocation location = RecordingLocation.remote("recordings/first.aac");

    attacher.attach(record.getId(), location);

    assertThat(repository.findById(record.getId()).orElseThrow().getRecordingLocation())
        .contains(location);
  }

  @Test
  void attach_shouldRejectSecondLocationNamingTheFirst() {
    CallRecord record = saveRecord();
    RecordingLocation first = RecordingLocation.remote("recordings/first.aac");
    attacher.attach(record.getId(), first);

    assertThatThrownBy(
            () -> attacher.attach(record.getId(), RecordingLocation.remote("recordings/second.aac")))
        .isInstanceOfSatisfying(
            ConflictException.class, e -> assertThat(e.existing()).isEqualTo(first));
    assertThat(repository.findById(record.getId()).orElseThrow().getRecordingLocation())
        .contains(first);
  }

  @Test
  void attach_shouldTreatSameLocationAsConflictWithItself() {
    CallRecord record = saveRecord();
    RecordingLocation location = RecordingLocation.remote("recordings/first.aac");
    attacher.attach(record.getId(), location);

    assertThatThrownBy(() -> attacher.attach(record.getId(), location))
        .isInstanceOfSatisfying(
            ConflictException.class, e -> assertThat(e.existing()).isEqualTo(location));
  }

  @Test
  void attach_shouldReportMissingCallRecord() {
    UUID missing = UUID.randomUUID();

    assertThatThrownBy(
            () -> attacher.attach(missing, RecordingLocation.remote("recordings/first.aac")))
        .isInstanceOfSatisfying(
            NotFoundException.class,
            e -> assertThat(e.what()).isEqualTo(NotFoundException.What.CALL_RECORD));
  }

  @Test
  void attach_shouldRejectLocationsTooLongToStore() {
    CallRecord record = saveRecord();
    String longKey = "recordings/" + "a".repeat(CallRecord.MAX_LOCATION_LENGTH) + ".aac";

    assertThatThrownBy(() -> attacher.attach(record.getId(), RecordingLocation.remote(longKey)))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void attach_shouldLetExactlyOneConcurrentAttemptWin() throws Exception {
    CallRecord record = saveRecord();
    int attempts = 8;
    ExecutorService pool = Executors.newFixedThreadPool(attempts);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<RecordingLocation>> results = new ArrayList<>();
    try {
      for (int i = 0; i < attempts; i++) {
        RecordingLocation candidate = RecordingLocation.remote("recordings/candidate-" + i + ".aac");
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  try {
                    attacher.attach(record.getId(), candidate);
                    return candidate;
                  } catch (ConflictException e) {
                    return null;
                  }
                }));
      }
      start.countDown();

      List<RecordingLocation> winners = new ArrayList<>();
      for (Future<RecordingLocation> result : results) {
        RecordingLocation winner = result.get();
        if (winner != null) {
          winners.add(winner);
        }
      }

      assertThat(winners).hasSize(1);
      assertThat(repository.findById(record.getId()).orElseThrow().getRecordingLocation())
          .contains(winners.get(0));
    } finally {
      pool.shutdownNow();
    }
  }

  private CallRecord saveRecord() {
    return repository.save(
        new CallRecord(
            UUID.randomUUID(), "lead-1", "agent-1", CallOutcome.CONNECTED, 42, Instant.now()));
  }
}
