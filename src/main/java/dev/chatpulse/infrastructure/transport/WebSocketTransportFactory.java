package dev.chatpulse.infrastructure.transport;

import dev.chatpulse.application.port.ChatTransport;
import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.application.port.TransportFactory;
import dev.chatpulse.domain.session.ChatEndpoint;
import dev.chatpulse.infrastructure.protocol.BadgeCache;
import dev.chatpulse.infrastructure.protocol.ChatFrameDecoder;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

/**
 * Opens {@link WebSocketChatTransport}s that share one OkHttp client and one badge cache.
 *
 * @since 0.1.0
 */
public final class WebSocketTransportFactory implements TransportFactory, AutoCloseable {
  /** Default bound for the upgrade plus the LOGIN acknowledgement. */
  public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
  /** Default keep-alive period. */
  public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(20);

  private final OkHttpClient client;
  private final BadgeCache badges;
  private final MetricsPort metrics;
  private final Duration handshakeTimeout;
  private final Duration pingInterval;

  /**
   * Creates a factory with its own OkHttp client.
   *
   * @param badges shared badge memo
   * @param metrics metrics sink
   * @param handshakeTimeout upgrade plus LOGIN acknowledgement bound
   * @param pingInterval keep-alive period
   */
  public WebSocketTransportFactory(
      BadgeCache badges, MetricsPort metrics, Duration handshakeTimeout, Duration pingInterval) {
    this(newClient(handshakeTimeout), badges, metrics, handshakeTimeout, pingInterval);
  }

  WebSocketTransportFactory(
      OkHttpClient client,
      BadgeCache badges,
      MetricsPort metrics,
      Duration handshakeTimeout,
      Duration pingInterval) {
    this.client = Objects.requireNonNull(client, "client");
    this.badges = Objects.requireNonNull(badges, "badges");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
    this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval");
  }

  @Override
  public ChatTransport open(ChatEndpoint endpoint) {
    return new WebSocketChatTransport(
        client, endpoint, new ChatFrameDecoder(badges, metrics), metrics, handshakeTimeout, pingInterval);
  }

  /** Stops the OkHttp dispatcher threads and drops pooled connections. */
  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }

  private static OkHttpClient newClient(Duration handshakeTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(0, TimeUnit.MILLISECONDS)
        .writeTimeout(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .retryOnConnectionFailure(false)
        .build();
  }
}
