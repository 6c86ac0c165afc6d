package com.scholary.recordings.blobstore;

import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.location.RecordingLocation;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem implementation of {@link BlobStore}.
 *
 * <p>Finished recordings go to the recordings directory and are addressed by absolute path. The
 * object directory stands in for the object store in development: objects PUT to the same-origin
 * upload endpoint land there and are addressed by their object key, so {@code remote:} locations
 * resolve without S3.
 *
 * <p>Writes go to a temporary file in the target directory, are forced to disk and then moved into
 * place, so readers never see a partial blob.
 */
public class LocalBlobStore implements BlobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalBlobStore.class);

  private final Path recordingsDir;
  private final Path objectDir;
  private final int maxPathLength;

  public LocalBlobStore(Path recordingsDir, Path objectDir, int maxPathLength) {
    this.recordingsDir = recordingsDir.toAbsolutePath().normalize();
    this.objectDir = objectDir.toAbsolutePath().normalize();
    this.maxPathLength = maxPathLength;

    try {
      Files.createDirectories(this.recordingsDir);
      Files.createDirectories(this.objectDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create storage directories", e);
    }

    LOGGER.info(
        "Initialized local blob store: recordingsDir={}, objectDir={}, maxPathLength={}",
        this.recordingsDir,
        this.objectDir,
        maxPathLength);
  }

  @Override
  public RecordingLocation put(InputStream data, long contentLength, String hint) {
    BlobNames.requireSafeHint(hint);
    Path target = recordingsDir.resolve(hint);
    RecordingLocation location = RecordingLocation.local(target);
    if (location.encode().length() > maxPathLength) {
      throw new ValidationException(
          String.format(
              "Recording path exceeds %d characters: %s", maxPathLength, location.encode()));
    }

    writeDurably(data, target, false);
    LOGGER.info("Stored recording: path={}, bytes={}", target, contentLength);
    return location;
  }

  /**
   * Store an object under its object key, as an object store would for a presigned PUT.
   *
   * @param objectKey the issued key, e.g. {@code recordings/<callRecordId>_<uuid>.aac}
   * @param data the object content
   * @return the remote location of the object
   */
  public RecordingLocation putObject(String objectKey, InputStream data) {
    if (!BlobNames.isIssuedObjectKey(objectKey)) {
      throw new ValidationException("Unknown object key: " + objectKey);
    }
    Path target = resolveObject(objectKey);
    try {
      Files.createDirectories(target.getParent());
    } catch (IOException e) {
      throw new TransientStorageException("Failed to create object directory for " + objectKey, e);
    }
    // Re-uploading to an issued key replaces the object, as a presigned PUT would
    writeDurably(data, target, true);
    LOGGER.info("Stored object: key={}", objectKey);
    return RecordingLocation.remote(objectKey);
  }

  @Override
  public byte[] readRange(RecordingLocation location, long offset, int length) {
    if (offset < 0 || length < 0) {
      throw new IllegalArgumentException("offset and length must be >= 0");
    }
    Path path = resolve(location);
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      long size = channel.size();
      if (offset >= size || length == 0) {
        return new byte[0];
      }
      int toRead = (int) Math.min(length, size - offset);
      ByteBuffer buffer = ByteBuffer.allocate(toRead);
      long position = offset;
      while (buffer.hasRemaining()) {
        int read = channel.read(buffer, position);
        if (read < 0) {
          break;
        }
        position += read;
      }
      if (buffer.hasRemaining()) {
        byte[] partial = new byte[buffer.position()];
        buffer.flip();
        buffer.get(partial);
        return partial;
      }
      return buffer.array();
    } catch (NoSuchFileException e) {
      throw new NotFoundException(What.BLOB, location.encode(), e);
    } catch (IOException e) {
      throw new TransientStorageException("Failed to read " + location, e);
    }
  }

  @Override
  public long size(RecordingLocation location) {
    Path path = resolve(location);
    try {
      return Files.size(path);
    } catch (NoSuchFileException e) {
      throw new NotFoundException(What.BLOB, location.encode(), e);
    } catch (IOException e) {
      throw new TransientStorageException("Failed to stat " + location, e);
    }
  }

  @Override
  public boolean exists(RecordingLocation location) {
    return Files.isRegularFile(resolve(location));
  }

  @Override
  public boolean delete(RecordingLocation location) {
    Path path = resolve(location);
    try {
      boolean deleted = Files.deleteIfExists(path);
      if (deleted) {
        LOGGER.info("Deleted blob: {}", location);
      } else {
        LOGGER.debug("Nothing to delete: {}", location);
      }
      return deleted;
    } catch (IOException e) {
      throw new TransientStorageException("Failed to delete " + location, e);
    }
  }

  Path recordingsDir() {
    return recordingsDir;
  }

  private Path resolve(RecordingLocation location) {
    if (location.isRemote()) {
      return resolveObject(location.objectKey());
    }
    Path path = location.path().toAbsolutePath().normalize();
    if (!path.startsWith(recordingsDir)) {
      LOGGER.warn("Local location outside recordings directory: {}", path);
      throw new NotFoundException(What.BLOB, location.encode());
    }
    return path;
  }

  private Path resolveObject(String objectKey) {
    Path path = objectDir.resolve(objectKey).normalize();
    if (!path.startsWith(objectDir) || objectKey.contains("..")) {
      throw new ValidationException("Illegal object key: " + objectKey);
    }
    return path;
  }

  private void writeDurably(InputStream data, Path target, boolean replaceExisting) {
    if (!replaceExisting && Files.exists(target)) {
      throw new TransientStorageException("Blob already exists: " + target);
    }
    Path temp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".part");
    try {
      try (FileChannel channel =
              FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
          OutputStream out = Channels.newOutputStream(channel)) {
        data.transferTo(out);
        out.flush();
        channel.force(true);
      }
      moveIntoPlace(temp, target, replaceExisting);
    } catch (FileAlreadyExistsException e) {
      throw new TransientStorageException("Blob already exists: " + target, e);
    } catch (IOException e) {
      throw new TransientStorageException("Failed to write blob: " + target, e);
    } finally {
      deleteQuietly(temp);
    }
  }

  private static void moveIntoPlace(Path temp, Path target, boolean replaceExisting)
      throws IOException {
    try {
      if (replaceExisting) {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } else {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      }
    } catch (AtomicMoveNotSupportedException e) {
      if (replaceExisting) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      } else {
        Files.move(temp, target);
      }
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove temporary file {}: {}", temp, e.getMessage());
    }
  }
}
