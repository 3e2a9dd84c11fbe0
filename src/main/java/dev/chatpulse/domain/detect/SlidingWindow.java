package dev.chatpulse.domain.detect;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Trailing time window of match timestamps.
 *
 * <p>Invariant after every {@link #record(long)}: entries are non-decreasing and all lie within
 * {@code [now - length, now]}. Appends are clamped to the newest entry so a clock step backwards never
 * breaks ordering.</p>
 *
 * <p>Not thread-safe; the owning tracker guards each window with its own lock.</p>
 *
 * @since 0.1.0
 */
public final class SlidingWindow {
  private final long lengthMillis;
  private final Deque<Long> timestamps = new ArrayDeque<>();

  /**
   * Creates an empty window.
   *
   * @param lengthMillis window length in milliseconds; must be positive
   */
  public SlidingWindow(long lengthMillis) {
    if (lengthMillis <= 0) {
      throw new IllegalArgumentException("lengthMillis must be positive (was " + lengthMillis + ")");
    }
    this.lengthMillis = lengthMillis;
  }

  /**
   * Drops entries older than {@code now - length}.
   *
   * @param nowMillis current time
   */
  public void prune(long nowMillis) {
    long cutoff = nowMillis - lengthMillis;
    while (!timestamps.isEmpty() && timestamps.peekFirst() < cutoff) {
      timestamps.pollFirst();
    }
  }

  /**
   * Clamps {@code nowMillis} to the newest entry and appends it. Callers prune first.
   *
   * @param nowMillis current time
   * @return the timestamp actually appended
   */
  public long append(long nowMillis) {
    Long newest = timestamps.peekLast();
    long effective = newest != null && newest > nowMillis ? newest : nowMillis;
    timestamps.addLast(effective);
    return effective;
  }

  /**
   * Prunes, appends, and returns the resulting count.
   *
   * @param nowMillis current time
   * @return number of entries in the window including the new one
   */
  public int record(long nowMillis) {
    prune(nowMillis);
    append(nowMillis);
    return timestamps.size();
  }

  /**
   * Returns the clamp point for the next append.
   *
   * @param nowMillis candidate time
   * @return {@code nowMillis}, or the newest entry when that is later
   */
  public long clamp(long nowMillis) {
    Long newest = timestamps.peekLast();
    return newest != null && newest > nowMillis ? newest : nowMillis;
  }

  /**
   * Returns the oldest retained timestamp.
   *
   * @return oldest entry, or {@link Long#MIN_VALUE} when empty
   */
  public long oldest() {
    Long first = timestamps.peekFirst();
    return first == null ? Long.MIN_VALUE : first;
  }

  /** Removes every entry. */
  public void clear() {
    timestamps.clear();
  }

  /**
   * Returns the number of retained entries.
   *
   * @return entry count
   */
  public int size() {
    return timestamps.size();
  }

  /**
   * Reports whether the window holds no entries.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return timestamps.isEmpty();
  }

  /**
   * Returns the configured window length.
   *
   * @return length in milliseconds
   */
  public long lengthMillis() {
    return lengthMillis;
  }
}
