package dev.chatpulse.application.port;

import dev.chatpulse.domain.session.ChatEndpoint;

/**
 * Opens a fresh {@link ChatTransport} for every connection attempt.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransportFactory {
  /**
   * Creates an unconnected transport.
   *
   * @param endpoint chat server address
   * @return new transport in state {@code DISCONNECTED}
   */
  ChatTransport open(ChatEndpoint endpoint);
}
