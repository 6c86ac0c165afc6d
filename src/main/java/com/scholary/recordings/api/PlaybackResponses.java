package com.scholary.recordings.api;

import com.scholary.recordings.service.Playback;
import com.scholary.recordings.service.RecordingStreamingService;
import java.net.URI;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/** Renders a {@link Playback} as a redirect, a full (200) or a partial (206) response. */
final class PlaybackResponses {

  private PlaybackResponses() {}

  static ResponseEntity<StreamingResponseBody> toResponse(
      Playback playback, RecordingStreamingService streamingService) {
    if (playback.isRedirect()) {
      return ResponseEntity.status(HttpStatus.FOUND)
          .location(URI.create(playback.redirectUrl()))
          .build();
    }

    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.ACCEPT_RANGES, "bytes");
    headers.setContentType(MediaType.parseMediaType(playback.contentType()));
    headers.setContentLength(playback.length());
    if (playback.isPartial()) {
      headers.set(HttpHeaders.CONTENT_RANGE, playback.range().contentRange(playback.size()));
    }

    StreamingResponseBody body = out -> streamingService.copy(playback, out);
    return ResponseEntity.status(playback.isPartial() ? HttpStatus.PARTIAL_CONTENT : HttpStatus.OK)
        .headers(headers)
        .body(body);
  }
}
