package com.scholary.recordings.session;

import com.scholary.recordings.location.RecordingLocation;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Tracks chunked uploads from init to finalize.
 *
 * <p>The received chunks of a session form a set keyed by index: appending an index twice replaces
 * its bytes and does not change the count. Sessions are independent and never wait on each other.
 * {@link #cancel} may run concurrently with {@link #append} or {@link #finalizeUpload} for the same
 * session; whichever runs second sees the session gone.
 */
public interface UploadSessionStore {

  /**
   * Start a session.
   *
   * @return the new session id
   */
  String init(UUID callRecordId, String fileName, int expectedChunks);

  Optional<UploadSession> find(String sessionId);

  /**
   * Store one chunk. Re-appending an index overwrites that chunk.
   *
   * @throws com.scholary.recordings.error.NotFoundException if the session does not exist
   * @throws com.scholary.recordings.error.ValidationException if the index is out of range or the
   *     chunk is too large
   */
  AppendResult append(String sessionId, int index, byte[] bytes);

  /** Indices received so far. Empty if the session does not exist. */
  Set<Integer> receivedChunks(String sessionId);

  /**
   * Concatenate chunks {@code 0..expectedChunks-1} in index order into one blob, then remove the
   * session and its chunks.
   *
   * @throws com.scholary.recordings.error.IncompleteUploadException if the received set does not
   *     hold exactly indices {@code 0..expectedChunks-1}; the session is kept
   * @throws com.scholary.recordings.error.NotFoundException if the session does not exist
   */
  RecordingLocation finalizeUpload(String sessionId, int expectedChunks);

  /** Remove the session and its chunks whatever their state. No-op if already gone. */
  void cancel(String sessionId);

  /** Ids of all sessions currently on record. */
  List<String> sessionIds();

  /** Time of the last init or append of a session, if it exists. */
  Optional<Instant> lastActivity(String sessionId);
}
