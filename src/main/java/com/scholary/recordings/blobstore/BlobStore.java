package com.scholary.recordings.blobstore;

import com.scholary.recordings.error.TransientStorageException;
import com.scholary.recordings.location.RecordingLocation;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Durable storage for finished recordings.
 *
 * <p>Implementations exist for the local filesystem and for S3-compatible object storage. Exactly
 * one is selected at startup from {@code storage.backend}; callers only ever see opaque {@link
 * RecordingLocation}s.
 *
 * <p>All implementations are safe for concurrent use.
 */
public interface BlobStore {

  /**
   * Store a recording.
   *
   * <p>The content is durable when this returns: a concurrent reader either sees nothing at the
   * returned location or the complete content.
   *
   * @param data the content, read to its end but not closed
   * @param contentLength number of bytes in {@code data}
   * @param hint file name for the blob; must not contain path separators or {@code ..}
   * @return the location of the stored blob
   * @throws com.scholary.recordings.error.ValidationException if the hint is unusable
   * @throws TransientStorageException if the write fails
   */
  RecordingLocation put(InputStream data, long contentLength, String hint);

  /**
   * Store the content of a file.
   *
   * @see #put(InputStream, long, String)
   */
  default RecordingLocation put(Path source, String hint) {
    try (InputStream in = Files.newInputStream(source)) {
      return put(in, Files.size(source), hint);
    } catch (IOException e) {
      throw new TransientStorageException("Failed to read source file: " + source, e);
    }
  }

  /**
   * Read part of a stored blob.
   *
   * @param location the blob
   * @param offset first byte to read
   * @param length maximum number of bytes to read
   * @return the bytes read; empty when {@code offset} is at or beyond the end of the blob
   * @throws com.scholary.recordings.error.NotFoundException if the blob does not exist
   */
  byte[] readRange(RecordingLocation location, long offset, int length);

  /**
   * Size of a stored blob in bytes.
   *
   * @throws com.scholary.recordings.error.NotFoundException if the blob does not exist
   */
  long size(RecordingLocation location);

  boolean exists(RecordingLocation location);

  /**
   * Delete a stored blob.
   *
   * @return {@code true} if it was deleted, {@code false} if there was nothing to delete
   */
  boolean delete(RecordingLocation location);
}
