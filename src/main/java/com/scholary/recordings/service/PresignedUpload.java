package com.scholary.recordings.service;

import com.scholary.recordings.presign.PresignedUrl;

/** Where a client should PUT a recording, and the key to confirm afterwards. */
public record PresignedUpload(String objectKey, String contentType, PresignedUrl url) {}
