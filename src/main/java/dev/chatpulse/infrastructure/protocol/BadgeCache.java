package dev.chatpulse.infrastructure.protocol;

import dev.chatpulse.domain.chat.Badge;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bounded LRU memo of permission bitmask to badge set.
 *
 * <p>Most chatters share a handful of bitmasks, so decomposition is done once per distinct value. The
 * table is guarded by one coarse lock; a lookup holds it only for the map access and the insert.</p>
 *
 * @since 0.1.0
 */
public final class BadgeCache {
  /** Default number of distinct bitmasks retained. */
  public static final int DEFAULT_CAPACITY = 256;

  private final int capacity;
  private final Map<Integer, Set<Badge>> entries;

  /** Creates a cache with {@link #DEFAULT_CAPACITY}. */
  public BadgeCache() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a cache.
   *
   * @param capacity maximum retained entries; must be positive
   */
  public BadgeCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.capacity = capacity;
    this.entries = new LinkedHashMap<>(16, 0.75f, true) {
      private static final long serialVersionUID = 1L;

      @Override
      protected boolean removeEldestEntry(Map.Entry<Integer, Set<Badge>> eldest) {
        return size() > BadgeCache.this.capacity;
      }
    };
  }

  /**
   * Returns the badges encoded in {@code bitmask}.
   *
   * @param bitmask raw permission bitmask
   * @return immutable badge set; equal to {@link Badge#decompose(int)} for every input
   */
  public Set<Badge> flagsFor(int bitmask) {
    synchronized (entries) {
      Set<Badge> cached = entries.get(bitmask);
      if (cached != null) {
        return cached;
      }
      Set<Badge> computed = Badge.decompose(bitmask);
      entries.put(bitmask, computed);
      return computed;
    }
  }

  /**
   * Returns the number of retained entries.
   *
   * @return current size, never above the capacity
   */
  public int size() {
    synchronized (entries) {
      return entries.size();
    }
  }

  public int capacity() {
    return capacity;
  }
}
