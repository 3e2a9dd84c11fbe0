package dev.chatpulse.config;

import dev.chatpulse.application.pipeline.SessionManager;
import dev.chatpulse.application.port.ClockPort;
import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.application.port.SessionArchive;
import dev.chatpulse.application.port.TransportFactory;
import dev.chatpulse.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import dev.chatpulse.infrastructure.persistence.JsonSessionArchive;
import dev.chatpulse.infrastructure.protocol.BadgeCache;
import dev.chatpulse.infrastructure.protocol.ChatFrameDecoder;
import dev.chatpulse.infrastructure.time.SystemClockAdapter;
import dev.chatpulse.infrastructure.transport.WebSocketTransportFactory;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link SessionManager} and its adapters from a {@link MonitorConfig}.
 * <p><strong>Role:</strong> Composition root for the {@code watch} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the metrics adapter, badge memo, WebSocket transport factory, and JSON archive.</li>
 *   <li>Own their lifecycles and release them in reverse order on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Built once on the CLI thread; {@link #close()} is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MonitorConfig config;
  private final MetricsPort metrics;
  private final AutoCloseable metricsHandle;
  private final TransportFactory transports;
  private final SessionArchive archive;
  private final SessionManager sessionManager;
  private boolean closed;

  /**
   * Builds the production graph.
   *
   * @param config validated settings
   */
  public CompositionRoot(MonitorConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint()),
        new SystemClockAdapter(), new BadgeCache(config.badgeCacheCapacity()));
  }

  private CompositionRoot(
      MonitorConfig config, OpenTelemetryMetricsAdapter metrics, ClockPort clock, BadgeCache badges) {
    this(config, metrics, metrics, clock, new WebSocketTransportFactory(
        badges, metrics, config.handshakeTimeout(), config.pingInterval()), badges);
  }

  CompositionRoot(
      MonitorConfig config,
      MetricsPort metrics,
      AutoCloseable metricsHandle,
      ClockPort clock,
      TransportFactory transports) {
    this(config, metrics, metricsHandle, clock, transports, new BadgeCache(config.badgeCacheCapacity()));
  }

  private CompositionRoot(
      MonitorConfig config,
      MetricsPort metrics,
      AutoCloseable metricsHandle,
      ClockPort clock,
      TransportFactory transports,
      BadgeCache badges) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsHandle = metricsHandle;
    this.transports = Objects.requireNonNull(transports, "transports");
    this.archive = new JsonSessionArchive(config.archiveDirectory(), config.zone(), clock);
    this.sessionManager = new SessionManager(
        transports,
        new ChatFrameDecoder(badges, metrics),
        archive,
        config.catalog(),
        config.detectionSettings(),
        config.pipelineSettings(),
        config.retryPolicy(),
        clock,
        metrics);
  }

  public MonitorConfig config() {
    return config;
  }

  public SessionArchive archive() {
    return archive;
  }

  public SessionManager sessionManager() {
    return sessionManager;
  }

  /** Closes the session manager, then the transport factory, then the metrics exporter. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    sessionManager.close();
    int pending = sessionManager.flushPending();
    if (pending > 0) {
      log.warn("{} session(s) could not be archived to {}", pending, config.archiveDirectory());
    }
    closeQuietly(transports);
    closeQuietly(metricsHandle);
  }

  private static void closeQuietly(Object resource) {
    if (!(resource instanceof AutoCloseable closeable)) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception ex) {
      log.warn("Failed to close {}", resource.getClass().getSimpleName(), ex);
    }
  }
}
