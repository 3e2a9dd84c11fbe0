package dev.chatpulse.infrastructure.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.chatpulse.domain.chat.Badge;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BadgeCacheTest {

  @Test
  void returnsSameResultAsDirectDecomposition() {
    BadgeCache cache = new BadgeCache(4);
    for (int mask : new int[] {0, 1, 4, 1 << 28, (1 << 2) | (1 << 15), -1, 12345}) {
      assertEquals(Badge.decompose(mask), cache.flagsFor(mask), "mask " + mask);
      assertEquals(Badge.decompose(mask), cache.flagsFor(mask), "cached mask " + mask);
    }
  }

  @Test
  void decomposesKnownBits() {
    Set<Badge> badges = new BadgeCache().flagsFor(Badge.BROADCASTER.bit() | Badge.SUBSCRIBER.bit() | (1 << 3));
    assertEquals(EnumSet.of(Badge.BROADCASTER, Badge.SUBSCRIBER), badges);
  }

  @Test
  void neverGrowsBeyondCapacity() {
    BadgeCache cache = new BadgeCache(8);
    for (int mask = 0; mask < 100; mask++) {
      cache.flagsFor(mask);
      assertTrue(cache.size() <= 8);
    }
    assertEquals(8, cache.size());
  }

  @Test
  void evictsLeastRecentlyUsedEntry() {
    BadgeCache cache = new BadgeCache(2);
    Set<Badge> first = cache.flagsFor(1);
    cache.flagsFor(2);
    assertSame(first, cache.flagsFor(1));
    cache.flagsFor(3);
    assertSame(first, cache.flagsFor(1));
    assertEquals(2, cache.size());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new BadgeCache(0));
  }
}
