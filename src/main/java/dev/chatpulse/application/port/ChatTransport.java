package dev.chatpulse.application.port;

import dev.chatpulse.domain.chat.ServiceType;
import dev.chatpulse.domain.chat.TransportState;

/**
 * <strong>What:</strong> Port owning one connection to a broadcaster's chat server.
 * <p><strong>Why:</strong> Keeps the socket library, TLS, and the connect/login/join handshake out of the
 * session lifecycle so the pipeline can be driven by an in-memory fake in tests.</p>
 * <p><strong>Role:</strong> Input port implemented by {@code WebSocketChatTransport}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the socket and complete the LOGIN handshake ({@link #connect()}).</li>
 *   <li>Send JOIN only after the LOGIN acknowledgement ({@link #join(String, String)}).</li>
 *   <li>Discard frames until the JOIN acknowledgement, then stream frames in order ({@link #run(FrameSink)}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #connect()}, {@link #join(String, String)}, and {@link #run(FrameSink)}
 * are called from one reader thread; {@link #close()} and {@link #state()} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Implementations emit {@code transport.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface ChatTransport extends AutoCloseable {
  /**
   * Opens the socket, sends LOGIN, and waits for its acknowledgement.
   *
   * @throws TransportException if the socket cannot be opened, the server rejects it, or the
   *     acknowledgement does not arrive within the handshake timeout
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  void connect() throws TransportException, InterruptedException;

  /**
   * Sends JOIN for a chat room.
   *
   * @param chatRoomId chat-room number
   * @param entryToken room credential
   * @throws IllegalStateException if the LOGIN acknowledgement has not been received; nothing is sent
   * @throws TransportException if the packet cannot be written
   */
  void join(String chatRoomId, String entryToken) throws TransportException;

  /**
   * Streams frames to {@code sink} until the connection ends.
   *
   * <p>Frames received before the JOIN acknowledgement are discarded. Returns normally on a clean
   * remote close or after {@link #close()}.</p>
   *
   * @param sink frame consumer
   * @throws TransportException if the connection fails while streaming
   * @throws InterruptedException if the calling thread is interrupted
   */
  void run(FrameSink sink) throws TransportException, InterruptedException;

  /**
   * Writes one packet.
   *
   * @param type service type for the header
   * @param body packet body
   * @throws TransportException if the socket is not open or rejects the write
   */
  void send(ServiceType type, String body) throws TransportException;

  /**
   * Returns the current connection phase.
   *
   * @return transport state
   */
  TransportState state();

  /**
   * Closes the socket and releases {@link #run(FrameSink)}. Idempotent.
   */
  @Override
  void close();
}
