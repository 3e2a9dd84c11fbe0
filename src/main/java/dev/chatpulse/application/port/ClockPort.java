package dev.chatpulse.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the detection pipeline.
 * <p><strong>Why:</strong> Sliding windows and cooldowns prune against the current time; tests inject a
 * deterministic clock to replay bursts at exact spacings.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every detection worker reads the
 * clock.</p>
 *
 * @since 0.1.0
 * @see dev.chatpulse.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments, so callers
   *     that need monotonic values clamp them
   */
  long nowMillis();
}
