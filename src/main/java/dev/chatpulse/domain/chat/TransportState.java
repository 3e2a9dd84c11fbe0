package dev.chatpulse.domain.chat;

/**
 * Connection phases of a chat transport.
 *
 * <p>Transitions run {@code DISCONNECTED -> CONNECTING -> AWAITING_LOGIN_ACK -> JOINING -> STREAMING};
 * any failure or close returns to {@code DISCONNECTED}.</p>
 *
 * @since 0.1.0
 */
public enum TransportState {
  DISCONNECTED,
  CONNECTING,
  AWAITING_LOGIN_ACK,
  JOINING,
  STREAMING
}
