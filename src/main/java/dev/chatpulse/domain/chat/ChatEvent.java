package dev.chatpulse.domain.chat;

import java.util.Objects;
import java.util.Set;

/**
 * Chat message decoded from a {@link ServiceType#CHAT} frame.
 *
 * @param text message text
 * @param userId sender account id
 * @param nickname sender display name
 * @param bitmask raw permission bitmask
 * @param badges badges derived from {@code bitmask}; copied into an unmodifiable set
 * @since 0.1.0
 */
public record ChatEvent(String text, String userId, String nickname, int bitmask, Set<Badge> badges)
    implements LiveEvent {

  /** Normalizes {@code null} strings and freezes the badge set. */
  public ChatEvent {
    text = Objects.requireNonNullElse(text, "");
    userId = Objects.requireNonNullElse(userId, "");
    nickname = Objects.requireNonNullElse(nickname, "");
    badges = badges == null ? Set.of() : Set.copyOf(badges);
  }

  @Override
  public ServiceType serviceType() {
    return ServiceType.CHAT;
  }
}
