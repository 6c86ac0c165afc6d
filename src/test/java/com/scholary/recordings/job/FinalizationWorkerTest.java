package com.scholary.recordings.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recordings.blobstore.BlobStore;
import com.scholary.recordings.blobstore.LocalBlobStore;
import com.scholary.recordings.callrecord.RecordingAttacher;
import com.scholary.recordings.error.ConflictException;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.location.RecordingLocation;
import com.scholary.recordings.session.FileSystemUploadSessionStore;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

/** Runs the worker against real local storage with a mocked attacher. */
@ExtendWith(MockitoExtension.class)
class FinalizationWorkerTest {

  private static final UUID CALL_RECORD_ID = UUID.randomUUID();

  @Mock private RecordingAttacher attacher;

  @TempDir Path tempDir;

  private LocalBlobStore blobStore;
  private FileSystemUploadSessionStore sessionStore;
  private FinalizationWorker worker;
  private FakeCheckpoint checkpoint;

  @BeforeEach
  void setUp() {
    blobStore = new LocalBlobStore(tempDir.resolve("recordings"), tempDir.resolve("objects"), 500);
    sessionStore =
        new FileSystemUploadSessionStore(
            tempDir.resolve("sessions"),
            blobStore,
            new ObjectMapper().findAndRegisterModules(),
            1024,
            100,
            Clock.systemUTC());
    worker = new FinalizationWorker(sessionStore, blobStore, attacher, Clock.systemUTC());
    checkpoint = new FakeCheckpoint();
  }

  @Test
  void chunkedJob_shouldFinalizeAndAttach() throws Exception {
    String sessionId = uploadAbc();

    JobOutcome outcome = worker.process(new ChunkedJob(sessionId, 3, CALL_RECORD_ID), checkpoint);

    assertThat(outcome.isCancelled()).isFalse();
    ArgumentCaptor<RecordingLocation> attached = ArgumentCaptor.forClass(RecordingLocation.class);
    verify(attacher).attach(eq(CALL_RECORD_ID), attached.capture());
    assertThat(Files.readString(attached.getValue().path())).isEqualTo("ABC");
    assertThat(checkpoint.staged).containsExactly(attached.getValue());
  }

  @Test
  void chunkedJob_shouldCancelSessionWhenIncomplete() {
    String sessionId = sessionStore.init(CALL_RECORD_ID, "call.aac", 3);
    sessionStore.append(sessionId, 0, bytes("A"));

    JobOutcome outcome = worker.process(new ChunkedJob(sessionId, 3, CALL_RECORD_ID), checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.cancelled(CancelReason.INCOMPLETE_UPLOAD));
    assertThat(sessionStore.find(sessionId)).isEmpty();
    assertThat(Files.exists(tempDir.resolve("sessions").resolve(sessionId))).isFalse();
    verify(attacher, never()).attach(any(), any());
  }

  @Test
  void chunkedJob_shouldCancelWhenSessionIsGone() {
    JobOutcome outcome =
        worker.process(new ChunkedJob("AAAAAAAAAAAAAAAAAAAAAA", 3, CALL_RECORD_ID), checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.cancelled(CancelReason.UPLOAD_NOT_FOUND));
  }

  @Test
  void chunkedJob_shouldLeaveNoResidueWhenCallRecordIsGone() throws Exception {
    String sessionId = uploadAbc();
    doThrow(new NotFoundException(What.CALL_RECORD, CALL_RECORD_ID.toString()))
        .when(attacher)
        .attach(eq(CALL_RECORD_ID), any());

    JobOutcome outcome = worker.process(new ChunkedJob(sessionId, 3, CALL_RECORD_ID), checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.cancelled(CancelReason.CALL_RECORD_NOT_FOUND));
    assertThat(listFiles(tempDir.resolve("recordings"))).isEmpty();
    assertThat(listFiles(tempDir.resolve("sessions"))).isEmpty();
  }

  @Test
  void chunkedJob_shouldTreatAlreadyAttachedAsSuccessAndDropDuplicateBlob() throws Exception {
    String sessionId = uploadAbc();
    RecordingLocation winner = RecordingLocation.remote("recordings/" + UUID.randomUUID() + ".aac");
    doThrow(new ConflictException("already attached", winner))
        .when(attacher)
        .attach(eq(CALL_RECORD_ID), any());

    JobOutcome outcome = worker.process(new ChunkedJob(sessionId, 3, CALL_RECORD_ID), checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.completed());
    assertThat(listFiles(tempDir.resolve("recordings"))).isEmpty();
  }

  @Test
  void chunkedJob_shouldKeepOwnBlobWhenItIsTheAttachedOne() throws Exception {
    String sessionId = uploadAbc();
    doAnswer(
            invocation -> {
              RecordingLocation location = invocation.getArgument(1);
              throw new ConflictException("already attached", location);
            })
        .when(attacher)
        .attach(eq(CALL_RECORD_ID), any());

    JobOutcome outcome = worker.process(new ChunkedJob(sessionId, 3, CALL_RECORD_ID), checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.completed());
    assertThat(listFiles(tempDir.resolve("recordings"))).hasSize(1);
  }

  @Test
  void chunkedJob_shouldSurfaceTransientAttachFailureAndResumeFromStagedBlob() throws Exception {
    String sessionId = uploadAbc();
    doThrow(new TransientStorageException("database unavailable"))
        .doNothing()
        .when(attacher)
        .attach(eq(CALL_RECORD_ID), any());
    ChunkedJob job = new ChunkedJob(sessionId, 3, CALL_RECORD_ID);

    assertThatThrownBy(() -> worker.process(job, checkpoint))
        .isInstanceOf(TransientStorageException.class);
    assertThat(sessionStore.find(sessionId)).isEmpty();
    assertThat(checkpoint.stagedLocation()).isPresent();

    JobOutcome retried = worker.process(job, checkpoint);

    assertThat(retried).isEqualTo(JobOutcome.completed());
    verify(attacher, Mockito.times(2)).attach(CALL_RECORD_ID, checkpoint.stagedLocation().get());
    assertThat(Files.readString(checkpoint.stagedLocation().get().path())).isEqualTo("ABC");
  }

  @Test
  void simpleJob_shouldStoreTempFileAndRemoveIt() throws Exception {
    Path temp = Files.writeString(tempDir.resolve("upload.tmp"), "whole file");

    JobOutcome outcome =
        worker.process(new SimpleJob(temp.toString(), CALL_RECORD_ID, "call.mp3"), checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.completed());
    assertThat(Files.exists(temp)).isFalse();
    RecordingLocation stored = checkpoint.stagedLocation().orElseThrow();
    assertThat(stored.fileName()).endsWith(".mp3");
    assertThat(Files.readString(stored.path())).isEqualTo("whole file");
    verify(attacher).attach(CALL_RECORD_ID, stored);
  }

  @Test
  void simpleJob_shouldDeleteBlobAndTempWhenCallRecordIsGone() throws Exception {
    Path temp = Files.writeString(tempDir.resolve("upload.tmp"), "whole file");
    doThrow(new NotFoundException(What.CALL_RECORD, CALL_RECORD_ID.toString()))
        .when(attacher)
        .attach(eq(CALL_RECORD_ID), any());

    JobOutcome outcome =
        worker.process(new SimpleJob(temp.toString(), CALL_RECORD_ID, "call.aac"), checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.cancelled(CancelReason.CALL_RECORD_NOT_FOUND));
    assertThat(Files.exists(temp)).isFalse();
    assertThat(listFiles(tempDir.resolve("recordings"))).isEmpty();
  }

  @Test
  void simpleJob_shouldKeepTempFileWhenStorageFails() throws Exception {
    Path temp = Files.writeString(tempDir.resolve("upload.tmp"), "whole file");
    BlobStore failing = Mockito.mock(BlobStore.class);
    Mockito.when(failing.put(any(Path.class), anyString()))
        .thenThrow(new TransientStorageException("disk full"));
    FinalizationWorker failingWorker =
        new FinalizationWorker(sessionStore, failing, attacher, Clock.systemUTC());

    assertThatThrownBy(
            () ->
                failingWorker.process(
                    new SimpleJob(temp.toString(), CALL_RECORD_ID, "call.aac"), checkpoint))
        .isInstanceOf(TransientStorageException.class);
    assertThat(Files.readString(temp)).isEqualTo("whole file");
    verify(attacher, never()).attach(any(), any());
  }

  @Test
  void simpleJob_shouldCancelWhenTempFileIsGone() {
    JobOutcome outcome =
        worker.process(
            new SimpleJob(tempDir.resolve("nope").toString(), CALL_RECORD_ID, "call.aac"),
            checkpoint);

    assertThat(outcome).isEqualTo(JobOutcome.cancelled(CancelReason.UPLOAD_NOT_FOUND));
  }

  private String uploadAbc() {
    String sessionId = sessionStore.init(CALL_RECORD_ID, "call.aac", 3);
    sessionStore.append(sessionId, 2, bytes("C"));
    sessionStore.append(sessionId, 0, bytes("A"));
    sessionStore.append(sessionId, 1, bytes("B"));
    return sessionId;
  }

  private static List<Path> listFiles(Path dir) throws Exception {
    try (Stream<Path> files = Files.list(dir)) {
      return files.toList();
    }
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static final class FakeCheckpoint implements JobCheckpoint {
    private final List<RecordingLocation> staged = new ArrayList<>();

    @Override
    public Optional<RecordingLocation> stagedLocation() {
      return staged.isEmpty() ? Optional.empty() : Optional.of(staged.get(staged.size() - 1));
    }

    @Override
    public void stage(RecordingLocation location) {
      staged.add(location);
    }
  }
}
