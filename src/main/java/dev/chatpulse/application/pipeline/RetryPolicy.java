package dev.chatpulse.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential reconnect backoff.
 *
 * @param maxRetries consecutive failures tolerated before the session is abandoned
 * @param initialDelay delay after the first failure
 * @param multiplier growth factor per further failure
 * @param maxDelay upper bound for any single delay
 * @since 0.1.0
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, double multiplier, Duration maxDelay) {
  /** Default growth factor between consecutive delays. */
  public static final double DEFAULT_MULTIPLIER = 2.0d;

  /** Validates the policy. */
  public RetryPolicy {
    Objects.requireNonNull(initialDelay, "initialDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0 (was " + maxRetries + ")");
    }
    if (initialDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("delays must be >= 0");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1 (was " + multiplier + ")");
    }
  }

  /**
   * Returns the stock policy: 5 retries, 1 s initial delay doubling up to 30 s.
   *
   * @return default policy
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(5, Duration.ofSeconds(1), DEFAULT_MULTIPLIER, Duration.ofSeconds(30));
  }

  /**
   * Computes the delay before reconnect attempt {@code attempt}.
   *
   * @param attempt 1-based count of consecutive failures so far
   * @return {@code min(initial * multiplier^(attempt-1), max)} in milliseconds
   */
  public long delayMillis(int attempt) {
    double raw = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
    return (long) Math.min(raw, (double) maxDelay.toMillis());
  }

  /**
   * Reports whether another attempt is allowed after {@code failures} consecutive failures.
   *
   * @param failures consecutive failures so far
   * @return {@code true} while {@code failures <= maxRetries}
   */
  public boolean allowsRetry(int failures) {
    return failures <= maxRetries;
  }
}
