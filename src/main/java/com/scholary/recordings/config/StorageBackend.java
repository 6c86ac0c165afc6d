package com.scholary.recordings.config;

/** Where finished recordings are kept. */
public enum StorageBackend {
  /** Local filesystem; upload URLs point back at this service. */
  LOCAL,
  /** S3 or an S3-compatible object store; upload and download URLs are presigned. */
  S3
}
