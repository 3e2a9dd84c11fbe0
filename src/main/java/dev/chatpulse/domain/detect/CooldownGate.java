package dev.chatpulse.domain.detect;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-winner trigger claim with a cooldown.
 *
 * <p>{@link #tryClaim(long)} succeeds when no trigger was claimed yet or at least the cooldown elapsed
 * since the last one; the claim is a compare-and-set on {@code lastTriggerAt}, so when several workers
 * cross a threshold at once exactly one of them wins.</p>
 *
 * @since 0.1.0
 */
public final class CooldownGate {
  private static final long NEVER = Long.MIN_VALUE;

  private final long cooldownMillis;
  private final AtomicLong lastTriggerAt = new AtomicLong(NEVER);

  /**
   * Creates a gate.
   *
   * @param cooldownMillis minimum spacing between claims; must be >= 0
   */
  public CooldownGate(long cooldownMillis) {
    if (cooldownMillis < 0) {
      throw new IllegalArgumentException("cooldownMillis must be >= 0 (was " + cooldownMillis + ")");
    }
    this.cooldownMillis = cooldownMillis;
  }

  /**
   * Attempts to claim a trigger at {@code nowMillis}.
   *
   * @param nowMillis time of the threshold crossing
   * @return {@code true} when this caller owns the trigger
   */
  public boolean tryClaim(long nowMillis) {
    while (true) {
      long last = lastTriggerAt.get();
      if (last != NEVER && nowMillis - last < cooldownMillis) {
        return false;
      }
      if (lastTriggerAt.compareAndSet(last, nowMillis)) {
        return true;
      }
    }
  }

  /**
   * Reports whether a claim at {@code nowMillis} would be suppressed.
   *
   * @param nowMillis candidate time
   * @return {@code true} while the cooldown is running
   */
  public boolean coolingDown(long nowMillis) {
    long last = lastTriggerAt.get();
    return last != NEVER && nowMillis - last < cooldownMillis;
  }

  /**
   * Returns the time of the last successful claim.
   *
   * @return epoch millis, or {@link Long#MIN_VALUE} when never claimed
   */
  public long lastTriggerAt() {
    return lastTriggerAt.get();
  }
}
