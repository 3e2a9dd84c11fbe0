package dev.chatpulse.domain.session;

import dev.chatpulse.validation.Numbers;
import dev.chatpulse.validation.Strings;
import java.net.URI;

/**
 * WebSocket address of a broadcaster's chat server.
 *
 * @param host chat server host
 * @param port chat server port
 * @param broadcasterId broadcaster account id, used as the last path segment
 * @param secure {@code true} for {@code wss}, {@code false} for plain {@code ws}
 * @since 0.1.0
 */
public record ChatEndpoint(String host, int port, String broadcasterId, boolean secure) {
  /** WebSocket subprotocol the chat server requires. */
  public static final String SUBPROTOCOL = "chat";

  /** Validates host, port, and broadcaster id. */
  public ChatEndpoint {
    host = Strings.requireIdentifier("host", host);
    Numbers.requireRange("port", port, 1, 65_535);
    broadcasterId = Strings.requireIdentifier("broadcaster", broadcasterId);
  }

  /**
   * Creates a TLS endpoint.
   *
   * @param host chat server host
   * @param port chat server port
   * @param broadcasterId broadcaster account id
   */
  public ChatEndpoint(String host, int port, String broadcasterId) {
    this(host, port, broadcasterId, true);
  }

  /**
   * Returns the socket address, e.g. {@code wss://chat.example:8001/Websocket/streamer}.
   *
   * @return WebSocket URI
   */
  public URI uri() {
    return URI.create((secure ? "wss" : "ws") + "://" + host + ":" + port + "/Websocket/" + broadcasterId);
  }
}
