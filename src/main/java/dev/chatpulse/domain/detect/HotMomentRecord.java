package dev.chatpulse.domain.detect;

import java.time.Instant;
import java.util.Objects;

/**
 * A completed per-meme burst.
 *
 * @param time instant the threshold was crossed
 * @param memeKind meme that burst
 * @param count matches inside the window at trigger time
 * @param description operator-facing summary
 * @since 0.1.0
 */
public record HotMomentRecord(Instant time, MemeKind memeKind, int count, String description) {

  /** Validates all fields. */
  public HotMomentRecord {
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(memeKind, "memeKind");
    Objects.requireNonNull(description, "description");
    if (count < 1) {
      throw new IllegalArgumentException("count must be >= 1 (was " + count + ")");
    }
  }

  /**
   * Builds a record with the standard description {@code "<display> burst: N occurrences in Ws"}.
   *
   * @param time trigger instant
   * @param memeKind meme that burst
   * @param count matches inside the window
   * @param windowSeconds window length used in the description
   * @return hot-moment record
   */
  public static HotMomentRecord of(Instant time, MemeKind memeKind, int count, long windowSeconds) {
    String description = memeKind.displayName() + " burst: " + count + " occurrences in " + windowSeconds + "s";
    return new HotMomentRecord(time, memeKind, count, description);
  }
}
