package dev.chatpulse.domain.chat;

/**
 * Decoded chat-room event handed from the reader thread to the detection workers.
 *
 * @since 0.1.0
 */
public interface LiveEvent {
  /**
   * Returns the service type this event was decoded from.
   *
   * @return originating service type
   */
  ServiceType serviceType();
}
