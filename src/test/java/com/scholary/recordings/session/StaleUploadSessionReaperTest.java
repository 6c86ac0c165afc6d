package com.scholary.recordings.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.recordings.config.IngestionProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StaleUploadSessionReaperTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Mock private UploadSessionStore sessionStore;

  @Test
  void reap_shouldCancelOnlyIdleSessions() {
    IngestionProperties properties =
        new IngestionProperties(
            "sessions",
            "tmp",
            1024,
            100,
            3,
            3,
            Duration.ofSeconds(2),
            Duration.ofMinutes(15),
            Duration.ofHours(1));
    StaleUploadSessionReaper reaper =
        new StaleUploadSessionReaper(
            sessionStore, properties, Clock.fixed(NOW, ZoneOffset.UTC));

    when(sessionStore.sessionIds()).thenReturn(List.of("idle", "active", "vanished"));
    when(sessionStore.lastActivity("idle")).thenReturn(Optional.of(NOW.minus(Duration.ofHours(2))));
    when(sessionStore.lastActivity("active"))
        .thenReturn(Optional.of(NOW.minus(Duration.ofMinutes(5))));
    when(sessionStore.lastActivity("vanished")).thenReturn(Optional.empty());

    int reaped = reaper.reap();

    assertThat(reaped).isEqualTo(1);
    verify(sessionStore).cancel("idle");
    verify(sessionStore, never()).cancel("active");
    verify(sessionStore, never()).cancel("vanished");
  }
}
