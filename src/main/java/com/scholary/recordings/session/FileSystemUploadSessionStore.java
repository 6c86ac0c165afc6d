package com.scholary.recordings.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.scholary.recordings.blobstore.BlobNames;
import com.scholary.recordings.blobstore.BlobStore;
import com.scholary.recordings.error.IncompleteUploadException;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.location.RecordingLocation;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UploadSessionStore} backed by one directory per session.
 *
 * <p>Layout: {@code <sessionDir>/<sessionId>/session.json} holds the {@link UploadSession}, and each
 * chunk is a file {@code chunk_<index>}. Chunks are written to a temporary file and moved into place,
 * so the set of {@code chunk_*} files is exactly the set of received indices, and it survives a
 * restart.
 *
 * <p>Appends to one session share a read lock and run in parallel; finalize and cancel take the
 * write lock. Locks are per session, so sessions never block each other. Locks are held weakly and
 * disappear once no thread uses them, so every holder keeps the {@link ReadWriteLock} itself, not
 * just its read or write view, until it unlocks.
 */
public class FileSystemUploadSessionStore implements UploadSessionStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemUploadSessionStore.class);

  private static final String METADATA_FILE = "session.json";
  private static final String CHUNK_PREFIX = "chunk_";
  private static final String ASSEMBLED_FILE = "assembled.part";
  private static final Pattern CHUNK_FILE = Pattern.compile("chunk_(\\d+)");
  private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{22}");

  private final Path sessionDir;
  private final BlobStore blobStore;
  private final ObjectMapper objectMapper;
  private final int maxChunkBytes;
  private final int maxExpectedChunks;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();
  private final LoadingCache<String, ReadWriteLock> locks =
      Caffeine.newBuilder().weakValues().build(id -> new ReentrantReadWriteLock());

  public FileSystemUploadSessionStore(
      Path sessionDir,
      BlobStore blobStore,
      ObjectMapper objectMapper,
      int maxChunkBytes,
      int maxExpectedChunks,
      Clock clock) {
    this.sessionDir = sessionDir.toAbsolutePath().normalize();
    this.blobStore = blobStore;
    this.objectMapper = objectMapper;
    this.maxChunkBytes = maxChunkBytes;
    this.maxExpectedChunks = maxExpectedChunks;
    this.clock = clock;

    try {
      Files.createDirectories(this.sessionDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create session directory: " + sessionDir, e);
    }

    LOGGER.info(
        "Initialized upload session store: sessionDir={}, maxChunkBytes={}, maxExpectedChunks={}",
        this.sessionDir,
        maxChunkBytes,
        maxExpectedChunks);
  }

  @Override
  public String init(UUID callRecordId, String fileName, int expectedChunks) {
    if (expectedChunks < 1 || expectedChunks > maxExpectedChunks) {
      throw new ValidationException(
          String.format("expected_chunks must be between 1 and %d", maxExpectedChunks));
    }

    String sessionId = newSessionId();
    Path dir = sessionDir.resolve(sessionId);
    UploadSession session =
        new UploadSession(sessionId, callRecordId, fileName, expectedChunks, clock.instant());

    try {
      Files.createDirectory(dir);
      Path temp = dir.resolve(METADATA_FILE + ".part");
      objectMapper.writeValue(temp.toFile(), session);
      move(temp, dir.resolve(METADATA_FILE));
    } catch (IOException e) {
      deleteRecursively(dir);
      throw new TransientStorageException("Failed to create upload session", e);
    }

    LOGGER.info(
        "Upload session initialized: sessionId={}, callRecordId={}, expectedChunks={}",
        sessionId,
        callRecordId,
        expectedChunks);
    return sessionId;
  }

  @Override
  public Optional<UploadSession> find(String sessionId) {
    if (!isValidId(sessionId)) {
      return Optional.empty();
    }
    return readMetadata(sessionId);
  }

  @Override
  public AppendResult append(String sessionId, int index, byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new ValidationException("chunk must not be empty");
    }
    if (bytes.length > maxChunkBytes) {
      throw new ValidationException(
          String.format("chunk exceeds %d bytes: %d", maxChunkBytes, bytes.length));
    }

    ReadWriteLock lock = lockFor(sessionId);
    lock.readLock().lock();
    try {
      UploadSession session =
          find(sessionId).orElseThrow(() -> new NotFoundException(What.UPLOAD_SESSION, sessionId));
      if (index < 0 || index >= session.expectedChunks()) {
        throw new ValidationException(
            String.format(
                "chunk index %d out of range 0..%d", index, session.expectedChunks() - 1));
      }

      Path dir = sessionDir.resolve(sessionId);
      Path temp = dir.resolve(CHUNK_PREFIX + index + "." + UUID.randomUUID() + ".part");
      try {
        Files.write(temp, bytes);
        move(temp, dir.resolve(CHUNK_PREFIX + index));
      } catch (NoSuchFileException e) {
        throw new NotFoundException(What.UPLOAD_SESSION, sessionId, e);
      } catch (IOException e) {
        deleteQuietly(temp);
        throw new TransientStorageException("Failed to store chunk " + index, e);
      }

      Set<Integer> received = listChunks(dir);
      long totalSize = totalChunkSize(dir, received);
      LOGGER.debug(
          "Chunk stored: sessionId={}, index={}, bytes={}, received={}/{}",
          sessionId,
          index,
          bytes.length,
          received.size(),
          session.expectedChunks());
      return new AppendResult(sessionId, received.size(), totalSize);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Set<Integer> receivedChunks(String sessionId) {
    if (!isValidId(sessionId)) {
      return Set.of();
    }
    return listChunks(sessionDir.resolve(sessionId));
  }

  @Override
  public RecordingLocation finalizeUpload(String sessionId, int expectedChunks) {
    ReadWriteLock lock = lockFor(sessionId);
    lock.writeLock().lock();
    try {
      UploadSession session =
          find(sessionId).orElseThrow(() -> new NotFoundException(What.UPLOAD_SESSION, sessionId));
      Path dir = sessionDir.resolve(sessionId);
      Set<Integer> received = listChunks(dir);
      if (!isComplete(received, expectedChunks)) {
        throw new IncompleteUploadException(sessionId, expectedChunks, received.size());
      }

      Path assembled = dir.resolve(ASSEMBLED_FILE);
      try {
        try (OutputStream out = Files.newOutputStream(assembled)) {
          // Declared order, not arrival order
          for (int index = 0; index < expectedChunks; index++) {
            Files.copy(dir.resolve(CHUNK_PREFIX + index), out);
          }
        }
      } catch (IOException e) {
        deleteQuietly(assembled);
        throw new TransientStorageException("Failed to assemble chunks of " + sessionId, e);
      }

      String hint = BlobNames.recordingHint(session.callRecordId(), session.fileName(), clock.instant());
      RecordingLocation location;
      try {
        location = blobStore.put(assembled, hint);
      } finally {
        deleteQuietly(assembled);
      }

      deleteRecursively(dir);
      LOGGER.info(
          "Upload session finalized: sessionId={}, chunks={}, location={}",
          sessionId,
          expectedChunks,
          location);
      return location;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void cancel(String sessionId) {
    if (!isValidId(sessionId)) {
      return;
    }
    ReadWriteLock lock = lockFor(sessionId);
    lock.writeLock().lock();
    try {
      Path dir = sessionDir.resolve(sessionId);
      if (Files.exists(dir)) {
        deleteRecursively(dir);
        LOGGER.info("Upload session cancelled: sessionId={}", sessionId);
      } else {
        LOGGER.debug("Cancel of unknown session ignored: sessionId={}", sessionId);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<String> sessionIds() {
    List<String> ids = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(sessionDir, Files::isDirectory)) {
      for (Path dir : stream) {
        String name = dir.getFileName().toString();
        if (isValidId(name)) {
          ids.add(name);
        }
      }
    } catch (IOException e) {
      throw new TransientStorageException("Failed to list upload sessions", e);
    }
    return ids;
  }

  @Override
  public Optional<Instant> lastActivity(String sessionId) {
    if (!isValidId(sessionId)) {
      return Optional.empty();
    }
    Path dir = sessionDir.resolve(sessionId);
    try (Stream<Path> files = Stream.concat(Stream.of(dir), Files.list(dir))) {
      // An empty directory still counts, so a half-created session can be reaped
      return files
          .map(FileSystemUploadSessionStore::modifiedTime)
          .filter(Optional::isPresent)
          .map(Optional::get)
          .max(Comparator.naturalOrder());
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new TransientStorageException("Failed to inspect upload session " + sessionId, e);
    }
  }

  static boolean isComplete(Set<Integer> received, int expectedChunks) {
    if (expectedChunks < 1 || received.size() != expectedChunks) {
      return false;
    }
    for (int index = 0; index < expectedChunks; index++) {
      if (!received.contains(index)) {
        return false;
      }
    }
    return true;
  }

  ReadWriteLock lockFor(String sessionId) {
    if (!isValidId(sessionId)) {
      throw new NotFoundException(What.UPLOAD_SESSION, String.valueOf(sessionId));
    }
    return locks.get(sessionId);
  }

  private Optional<UploadSession> readMetadata(String sessionId) {
    Path metadata = sessionDir.resolve(sessionId).resolve(METADATA_FILE);
    if (!Files.isRegularFile(metadata)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(metadata.toFile(), UploadSession.class));
    } catch (IOException e) {
      if (!Files.exists(metadata)) {
        // Cancelled between the check and the read
        return Optional.empty();
      }
      throw new TransientStorageException("Failed to read upload session " + sessionId, e);
    }
  }

  private static Set<Integer> listChunks(Path dir) {
    Set<Integer> indices = new TreeSet<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, CHUNK_PREFIX + "*")) {
      for (Path file : stream) {
        Matcher matcher = CHUNK_FILE.matcher(file.getFileName().toString());
        if (matcher.matches()) {
          indices.add(Integer.parseInt(matcher.group(1)));
        }
      }
    } catch (NoSuchFileException e) {
      return Set.of();
    } catch (IOException e) {
      throw new TransientStorageException("Failed to list chunks in " + dir, e);
    }
    return indices;
  }

  private static long totalChunkSize(Path dir, Set<Integer> indices) {
    long total = 0;
    for (int index : indices) {
      try {
        total += Files.size(dir.resolve(CHUNK_PREFIX + index));
      } catch (IOException e) {
        LOGGER.debug("Chunk {} vanished while sizing {}", index, dir);
      }
    }
    return total;
  }

  private String newSessionId() {
    byte[] bytes = new byte[16];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private static boolean isValidId(String sessionId) {
    return sessionId != null && SESSION_ID.matcher(sessionId).matches();
  }

  private static Optional<Instant> modifiedTime(Path file) {
    try {
      FileTime time = Files.getLastModifiedTime(file);
      return Optional.of(time.toInstant());
    } catch (IOException e) {
      return Optional.empty();
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove temporary file {}: {}", file, e.getMessage());
    }
  }

  private static void deleteRecursively(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(FileSystemUploadSessionStore::deleteQuietly);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove session directory {}: {}", dir, e.getMessage());
    }
  }
}
