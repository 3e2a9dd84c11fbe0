package dev.chatpulse.domain.detect;

import java.time.Instant;
import java.util.Objects;

/**
 * Aggregate activity spike across all memes.
 *
 * @param time instant the wave fired
 * @param count aggregate matches inside the window at trigger time
 * @since 0.1.0
 */
public record WaveEvent(Instant time, int count) {

  /** Validates fields. */
  public WaveEvent {
    Objects.requireNonNull(time, "time");
  }
}
