package dev.chatpulse.infrastructure.transport;

import dev.chatpulse.application.port.ChatTransport;
import dev.chatpulse.application.port.FrameSink;
import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.application.port.TransportException;
import dev.chatpulse.domain.chat.RawFrame;
import dev.chatpulse.domain.chat.ServiceType;
import dev.chatpulse.domain.chat.TransportState;
import dev.chatpulse.domain.session.ChatEndpoint;
import dev.chatpulse.infrastructure.protocol.ChatFrameDecoder;
import dev.chatpulse.infrastructure.protocol.ChatPacketBuilder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChatTransport} over an OkHttp WebSocket.
 *
 * <p>OkHttp delivers socket events on its own reader thread; the listener hands them to the thread
 * calling {@link #connect()} and {@link #run(FrameSink)} through a small bounded inbox. A full inbox
 * blocks the OkHttp reader, so a slow sink throttles socket reads instead of buffering without
 * bound.</p>
 *
 * <p>Instances serve one connection attempt and are not reusable after {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class WebSocketChatTransport implements ChatTransport {
  private static final Logger log = LoggerFactory.getLogger(WebSocketChatTransport.class);
  private static final int INBOX_CAPACITY = 64;
  private static final long HANDOFF_RETRY_MILLIS = 100L;
  private static final int NORMAL_CLOSURE = 1000;

  private final OkHttpClient client;
  private final ChatEndpoint endpoint;
  private final ChatFrameDecoder decoder;
  private final MetricsPort metrics;
  private final Duration handshakeTimeout;
  private final Duration pingInterval;
  private final BlockingQueue<Inbound> inbox = new ArrayBlockingQueue<>(INBOX_CAPACITY);
  private final Deque<RawFrame> backlog = new ArrayDeque<>();
  private final AtomicReference<TransportState> state = new AtomicReference<>(TransportState.DISCONNECTED);
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile WebSocket socket;
  private volatile boolean loginAcknowledged;

  /**
   * Creates an unconnected transport.
   *
   * @param client shared OkHttp client
   * @param endpoint chat server address
   * @param decoder frame decoder owned by this transport
   * @param metrics metrics sink for {@code transport.*}
   * @param handshakeTimeout bound for the upgrade plus the LOGIN acknowledgement
   * @param pingInterval keep-alive period while streaming
   */
  public WebSocketChatTransport(
      OkHttpClient client,
      ChatEndpoint endpoint,
      ChatFrameDecoder decoder,
      MetricsPort metrics,
      Duration handshakeTimeout,
      Duration pingInterval) {
    this.client = Objects.requireNonNull(client, "client");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
    this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval");
    if (pingInterval.isZero() || pingInterval.isNegative()) {
      throw new IllegalArgumentException("pingInterval must be positive");
    }
  }

  @Override
  public void connect() throws TransportException, InterruptedException {
    if (closed.get()) {
      throw new TransportException("transport already closed");
    }
    if (!state.compareAndSet(TransportState.DISCONNECTED, TransportState.CONNECTING)) {
      throw new IllegalStateException("connect() called in state " + state.get());
    }
    metrics.increment("transport.connect.attempts");
    Request request = new Request.Builder()
        .url(endpoint.uri().toString())
        .header("Sec-WebSocket-Protocol", ChatEndpoint.SUBPROTOCOL)
        .build();
    log.debug("Opening chat socket {}", endpoint.uri());
    socket = client.newWebSocket(request, new Listener());

    long deadline = System.nanoTime() + handshakeTimeout.toNanos();
    Inbound opened = awaitInbound(deadline);
    if (opened == null) {
      throw fail("timed out after " + handshakeTimeout.toMillis() + " ms waiting for the WebSocket upgrade", null);
    }
    if (opened.kind() != Kind.OPEN) {
      throw fail(describe(opened), opened.error());
    }

    state.set(TransportState.AWAITING_LOGIN_ACK);
    write(ChatPacketBuilder.login());
    while (!loginAcknowledged) {
      Inbound next = awaitInbound(deadline);
      if (next == null) {
        throw fail("timed out after " + handshakeTimeout.toMillis() + " ms waiting for the login acknowledgement", null);
      }
      if (next.kind() != Kind.DATA) {
        throw fail(describe(next), next.error());
      }
      for (RawFrame frame : decoder.feed(next.data())) {
        if (!loginAcknowledged && ServiceType.LOGIN.code().equals(frame.serviceCode())) {
          loginAcknowledged = true;
        } else if (loginAcknowledged) {
          backlog.addLast(frame);
        } else {
          metrics.increment("transport.frames.preLogin.discarded");
        }
      }
    }
    metrics.increment("transport.login.acknowledged");
    log.debug("Login acknowledged by {}", endpoint.host());
  }

  @Override
  public void join(String chatRoomId, String entryToken) throws TransportException {
    Objects.requireNonNull(chatRoomId, "chatRoomId");
    Objects.requireNonNull(entryToken, "entryToken");
    if (!loginAcknowledged || closed.get()) {
      throw new IllegalStateException("JOIN requires an acknowledged LOGIN (state " + state.get() + ")");
    }
    write(ChatPacketBuilder.join(chatRoomId, entryToken));
    state.set(TransportState.JOINING);
  }

  @Override
  public void run(FrameSink sink) throws TransportException, InterruptedException {
    Objects.requireNonNull(sink, "sink");
    TransportState current = state.get();
    if (current != TransportState.JOINING && current != TransportState.STREAMING) {
      if (closed.get()) {
        return;
      }
      throw new IllegalStateException("run() requires a sent JOIN (state " + current + ")");
    }
    while (!backlog.isEmpty()) {
      dispatch(backlog.pollFirst(), sink);
    }
    long pingNanos = pingInterval.toNanos();
    long nextPing = System.nanoTime() + pingNanos;
    while (!closed.get()) {
      long wait = nextPing - System.nanoTime();
      if (wait <= 0) {
        write(ChatPacketBuilder.ping());
        metrics.increment("transport.ping.sent");
        nextPing = System.nanoTime() + pingNanos;
        continue;
      }
      Inbound next = inbox.poll(wait, TimeUnit.NANOSECONDS);
      if (next == null) {
        continue;
      }
      switch (next.kind()) {
        case DATA -> {
          for (RawFrame frame : decoder.feed(next.data())) {
            dispatch(frame, sink);
          }
        }
        case CLOSED -> {
          state.set(TransportState.DISCONNECTED);
          log.info("Chat socket closed: {}", next.reason());
          return;
        }
        case FAILED -> {
          if (closed.get()) {
            return;
          }
          throw fail(describe(next), next.error());
        }
        default -> {
          // OPEN is only expected during connect()
        }
      }
    }
    state.set(TransportState.DISCONNECTED);
  }

  @Override
  public void send(ServiceType type, String body) throws TransportException {
    write(ChatPacketBuilder.packet(type, body));
  }

  @Override
  public TransportState state() {
    return state.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    state.set(TransportState.DISCONNECTED);
    WebSocket ws = socket;
    if (ws != null) {
      ws.close(NORMAL_CLOSURE, "client closing");
    }
    inbox.clear();
    inbox.offer(Inbound.closed("closed locally"));
  }

  private void dispatch(RawFrame frame, FrameSink sink) throws InterruptedException {
    if (state.get() == TransportState.JOINING) {
      if (ServiceType.JOIN.code().equals(frame.serviceCode())) {
        state.set(TransportState.STREAMING);
        metrics.increment("transport.join.acknowledged");
        log.debug("Join acknowledged; streaming chat frames");
      } else {
        metrics.increment("transport.frames.preJoin.discarded");
      }
      return;
    }
    metrics.increment("transport.frames.streamed");
    sink.onFrame(frame);
  }

  private void write(byte[] packet) throws TransportException {
    WebSocket ws = socket;
    if (ws == null || closed.get()) {
      throw new TransportException("chat socket is not open");
    }
    if (!ws.send(ByteString.of(packet))) {
      throw fail("chat socket rejected an outbound packet", null);
    }
  }

  private Inbound awaitInbound(long deadlineNanos) throws InterruptedException {
    long remaining = deadlineNanos - System.nanoTime();
    if (remaining <= 0) {
      return null;
    }
    return inbox.poll(remaining, TimeUnit.NANOSECONDS);
  }

  private TransportException fail(String message, Throwable cause) {
    state.set(TransportState.DISCONNECTED);
    metrics.increment("transport.failures");
    WebSocket ws = socket;
    if (ws != null) {
      ws.cancel();
    }
    return new TransportException(message, cause);
  }

  private static String describe(Inbound inbound) {
    return switch (inbound.kind()) {
      case CLOSED -> "chat socket closed: " + inbound.reason();
      case FAILED -> "chat socket failed: " + inbound.reason();
      default -> "unexpected socket event " + inbound.kind();
    };
  }

  private void handOff(Inbound inbound) {
    try {
      while (!closed.get()) {
        if (inbox.offer(inbound, HANDOFF_RETRY_MILLIS, TimeUnit.MILLISECONDS)) {
          return;
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  private final class Listener extends WebSocketListener {
    @Override
    public void onOpen(WebSocket webSocket, Response response) {
      handOff(Inbound.open());
    }

    @Override
    public void onMessage(WebSocket webSocket, ByteString bytes) {
      handOff(Inbound.data(bytes.toByteArray()));
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
      handOff(Inbound.data(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
      webSocket.close(NORMAL_CLOSURE, null);
      handOff(Inbound.closed(code + " " + reason));
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
      String reason = response != null ? "HTTP " + response.code() + ": " + t : String.valueOf(t);
      handOff(Inbound.failed(reason, t));
    }
  }

  private enum Kind {
    OPEN,
    DATA,
    CLOSED,
    FAILED
  }

  private record Inbound(Kind kind, byte[] data, String reason, Throwable error) {
    static Inbound open() {
      return new Inbound(Kind.OPEN, null, null, null);
    }

    static Inbound data(byte[] data) {
      return new Inbound(Kind.DATA, data, null, null);
    }

    static Inbound closed(String reason) {
      return new Inbound(Kind.CLOSED, null, reason, null);
    }

    static Inbound failed(String reason, Throwable error) {
      return new Inbound(Kind.FAILED, null, reason, error);
    }
  }
}
