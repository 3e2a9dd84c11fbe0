package dev.chatpulse.domain.detect;

import java.time.Duration;
import java.util.Objects;

/**
 * Detector tuning: window length, trigger thresholds, wave minimum duration, and cooldown.
 *
 * @param window trailing window shared by wave and hot-moment tracking
 * @param waveThreshold minimum aggregate matches inside the window for a wave
 * @param hotMomentThreshold minimum matches of one meme inside the window for a hot moment
 * @param waveMinDuration minimum span between the first and latest match before a wave may fire
 * @param cooldown minimum spacing between two triggers of the same tracker
 * @since 0.1.0
 */
public record DetectionSettings(
    Duration window,
    int waveThreshold,
    int hotMomentThreshold,
    Duration waveMinDuration,
    Duration cooldown) {

  /** Default window length. */
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(10);
  /** Default wave and hot-moment threshold. */
  public static final int DEFAULT_THRESHOLD = 20;
  /** Default cooldown between triggers. */
  public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);

  /** Validates all durations and thresholds. */
  public DetectionSettings {
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(waveMinDuration, "waveMinDuration");
    Objects.requireNonNull(cooldown, "cooldown");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (waveMinDuration.isNegative()) {
      throw new IllegalArgumentException("waveMinDuration must be >= 0");
    }
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException("cooldown must be >= 0");
    }
    if (waveThreshold < 1 || hotMomentThreshold < 1) {
      throw new IllegalArgumentException("thresholds must be >= 1");
    }
  }

  /**
   * Returns the stock settings: 10 s window, threshold 20, 10 s wave duration, 60 s cooldown.
   *
   * @return default settings
   */
  public static DetectionSettings defaults() {
    return new DetectionSettings(
        DEFAULT_WINDOW, DEFAULT_THRESHOLD, DEFAULT_THRESHOLD, DEFAULT_WINDOW, DEFAULT_COOLDOWN);
  }
}
