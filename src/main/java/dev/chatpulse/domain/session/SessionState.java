package dev.chatpulse.domain.session;

/**
 * Lifecycle of the session owner: {@code IDLE -> ACTIVE -> CLOSING -> IDLE}.
 *
 * @since 0.1.0
 */
public enum SessionState {
  /** No broadcast is being tracked. */
  IDLE,
  /** A session is open and the reader thread is streaming or reconnecting. */
  ACTIVE,
  /** The pipeline is draining and the session is being archived. */
  CLOSING
}
