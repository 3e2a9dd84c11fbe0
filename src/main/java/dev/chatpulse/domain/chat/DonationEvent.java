package dev.chatpulse.domain.chat;

import java.util.Objects;

/**
 * Donation decoded from a {@link ServiceType#DONATION} frame.
 *
 * @param nickname donor display name
 * @param count number of stars/points donated; never negative
 * @since 0.1.0
 */
public record DonationEvent(String nickname, int count) implements LiveEvent {

  /** Validates the donation amount. */
  public DonationEvent {
    nickname = Objects.requireNonNullElse(nickname, "");
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0 (was " + count + ")");
    }
  }

  @Override
  public ServiceType serviceType() {
    return ServiceType.DONATION;
  }
}
