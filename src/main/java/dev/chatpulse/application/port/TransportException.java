package dev.chatpulse.application.port;

/**
 * Checked failure of a {@link ChatTransport}: connection refused or reset, handshake timeout, or an
 * unexpected socket failure while streaming.
 *
 * <p>Recoverable by reconnecting; the session owner decides how often.</p>
 *
 * @since 0.1.0
 */
public class TransportException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message failure description
   */
  public TransportException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message failure description
   * @param cause underlying failure
   */
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
