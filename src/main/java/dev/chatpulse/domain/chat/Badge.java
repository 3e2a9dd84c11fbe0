package dev.chatpulse.domain.chat;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Display flags encoded in a chatter's permission bitmask.
 *
 * @since 0.1.0
 */
public enum Badge {
  ADMIN(1),
  HIDDEN(1 << 1),
  BROADCASTER(1 << 2),
  GUEST(1 << 4),
  FAN_CLUB(1 << 5),
  MANAGER(1 << 8),
  FEMALE(1 << 9),
  MOBILE(1 << 14),
  TOP_FAN(1 << 15),
  QUICK_VIEW(1 << 19),
  SUBSCRIBER(1 << 28);

  private final int bit;

  Badge(int bit) {
    this.bit = bit;
  }

  /**
   * Returns the single bit this badge occupies.
   *
   * @return bit value
   */
  public int bit() {
    return bit;
  }

  /**
   * Decomposes a bitmask into its badges. Unknown bits are ignored.
   *
   * @param bitmask raw permission bitmask
   * @return unmodifiable set of badges present in {@code bitmask}
   */
  public static Set<Badge> decompose(int bitmask) {
    EnumSet<Badge> badges = EnumSet.noneOf(Badge.class);
    for (Badge badge : values()) {
      if ((bitmask & badge.bit) != 0) {
        badges.add(badge);
      }
    }
    return Collections.unmodifiableSet(badges);
  }
}
