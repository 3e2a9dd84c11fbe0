package dev.chatpulse.config;

import dev.chatpulse.application.pipeline.PipelineSettings;
import dev.chatpulse.application.pipeline.RetryPolicy;
import dev.chatpulse.domain.detect.DetectionSettings;
import dev.chatpulse.infrastructure.protocol.BadgeCache;
import dev.chatpulse.infrastructure.transport.WebSocketTransportFactory;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened defaults for every optional {@code watch} key.
 *
 * <p>Connection keys ({@code host}, {@code port}, {@code broadcaster}, {@code chatRoom}, {@code token})
 * have no default and must come from YAML or the command line.</p>
 */
public final class MonitorDefaults {
  /** Zone used to date archived sessions unless {@code zone} is set. */
  public static final String DEFAULT_ZONE = "Asia/Seoul";

  private static final Map<String, String> DEFAULTS = build();

  private MonitorDefaults() {}

  /**
   * Returns the defaults.
   *
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> build() {
    DetectionSettings detection = DetectionSettings.defaults();
    PipelineSettings pipeline = PipelineSettings.defaults();
    RetryPolicy retry = RetryPolicy.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("secure", "true");
    map.put("memes", "");
    map.put("queueCapacity", Integer.toString(pipeline.queueCapacity()));
    map.put("workers", Integer.toString(pipeline.workers()));
    map.put("shutdownTimeoutSeconds", Long.toString(pipeline.shutdownTimeout().toSeconds()));
    map.put("windowSeconds", Long.toString(detection.window().toSeconds()));
    map.put("waveThreshold", Integer.toString(detection.waveThreshold()));
    map.put("hotMomentThreshold", Integer.toString(detection.hotMomentThreshold()));
    map.put("waveMinDurationSeconds", Long.toString(detection.waveMinDuration().toSeconds()));
    map.put("cooldownSeconds", Long.toString(detection.cooldown().toSeconds()));
    map.put("badgeCacheCapacity", Integer.toString(BadgeCache.DEFAULT_CAPACITY));
    map.put("maxRetries", Integer.toString(retry.maxRetries()));
    map.put("backoffInitialMillis", Long.toString(retry.initialDelay().toMillis()));
    map.put("backoffMaxMillis", Long.toString(retry.maxDelay().toMillis()));
    map.put("handshakeTimeoutMillis",
        Long.toString(WebSocketTransportFactory.DEFAULT_HANDSHAKE_TIMEOUT.toMillis()));
    map.put("pingIntervalSeconds", Long.toString(WebSocketTransportFactory.DEFAULT_PING_INTERVAL.toSeconds()));
    map.put("archiveDir", "~/.chatpulse/sessions");
    map.put("zone", DEFAULT_ZONE);
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    return Map.copyOf(map);
  }
}
