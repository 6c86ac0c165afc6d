package com.scholary.recordings.session;

import com.scholary.recordings.config.IngestionProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Cancels upload sessions that saw no init or append for {@code ingestion.session-idle-timeout}. */
@Component
public class StaleUploadSessionReaper {

  private static final Logger LOGGER = LoggerFactory.getLogger(StaleUploadSessionReaper.class);

  private final UploadSessionStore sessionStore;
  private final IngestionProperties properties;
  private final Clock clock;

  public StaleUploadSessionReaper(
      UploadSessionStore sessionStore, IngestionProperties properties, Clock clock) {
    this.sessionStore = sessionStore;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${ingestion.session-reap-interval:PT5M}")
  public int reap() {
    Instant cutoff = clock.instant().minus(properties.sessionIdleTimeout());
    int reaped = 0;
    for (String sessionId : sessionStore.sessionIds()) {
      Optional<Instant> lastActivity = sessionStore.lastActivity(sessionId);
      if (lastActivity.isPresent() && lastActivity.get().isBefore(cutoff)) {
        LOGGER.info(
            "Cancelling idle upload session: sessionId={}, lastActivity={}",
            sessionId,
            lastActivity.get());
        sessionStore.cancel(sessionId);
        reaped++;
      }
    }
    return reaped;
  }
}
