package dev.chatpulse.config;

import dev.chatpulse.application.pipeline.PipelineSettings;
import dev.chatpulse.application.pipeline.RetryPolicy;
import dev.chatpulse.domain.detect.DetectionSettings;
import dev.chatpulse.domain.detect.MemeCatalog;
import dev.chatpulse.domain.session.BroadcastStatus;
import dev.chatpulse.domain.session.ChatEndpoint;
import dev.chatpulse.validation.Numbers;
import dev.chatpulse.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validated settings for the {@code watch} command.
 *
 * @param host chat server host
 * @param port chat server port
 * @param broadcaster broadcaster id used in the WebSocket path
 * @param secure {@code true} for {@code wss}
 * @param chatRoom chat room number sent in JOIN
 * @param token room entry token sent in JOIN
 * @param broadcastId broadcast identifier recorded with the session
 * @param title broadcast title recorded with the session
 * @param memes meme keys to track; empty tracks every built-in meme
 * @param queueCapacity ingest queue bound
 * @param workers detection worker count
 * @param shutdownTimeout drain bound on close
 * @param window detection window length
 * @param waveThreshold matches needed for a wave
 * @param hotMomentThreshold matches of one meme needed for a hot moment
 * @param waveMinDuration minimum span of a wave window
 * @param cooldown minimum spacing between triggers of one kind
 * @param badgeCacheCapacity badge memo size
 * @param maxRetries reconnect attempts after a failure
 * @param backoffInitial first reconnect delay
 * @param backoffMax reconnect delay cap
 * @param handshakeTimeout WebSocket upgrade and LOGIN acknowledgement bound
 * @param pingInterval keep-alive period
 * @param archiveDirectory directory for daily session documents
 * @param zone zone used to date sessions
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint, or {@code null} for the exporter default
 * @since 0.1.0
 */
public record MonitorConfig(
    String host,
    int port,
    String broadcaster,
    boolean secure,
    String chatRoom,
    String token,
    String broadcastId,
    String title,
    Set<String> memes,
    int queueCapacity,
    int workers,
    Duration shutdownTimeout,
    Duration window,
    int waveThreshold,
    int hotMomentThreshold,
    Duration waveMinDuration,
    Duration cooldown,
    int badgeCacheCapacity,
    int maxRetries,
    Duration backoffInitial,
    Duration backoffMax,
    Duration handshakeTimeout,
    Duration pingInterval,
    Path archiveDirectory,
    ZoneId zone,
    String metricsExporter,
    String otelEndpoint) {

  public MonitorConfig {
    memes = Set.copyOf(Objects.requireNonNull(memes, "memes"));
    if (backoffMax.compareTo(backoffInitial) < 0) {
      throw new IllegalArgumentException("backoffMaxMillis must be >= backoffInitialMillis");
    }
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param kv flattened settings, usually {@link MonitorDefaults} overlaid with YAML and CLI values
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is out of range
   */
  public static MonitorConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    String host = Strings.requireIdentifier("host", required(kv, "host"));
    int port = intValue(kv, "port", 1, 65_535);
    String broadcaster = Strings.requireIdentifier("broadcaster", required(kv, "broadcaster"));
    String chatRoom = Strings.requireNonBlank("chatRoom", required(kv, "chatRoom"));
    String token = Strings.requireNonBlank("token", required(kv, "token"));
    String broadcastId = Strings.optional("broadcastId", kv.get("broadcastId"));
    String title = Strings.optional("title", kv.get("title"));

    long backoffInitial = longValue(kv, "backoffInitialMillis", 1, 600_000);
    long backoffMax = longValue(kv, "backoffMaxMillis", 1, 3_600_000);

    return new MonitorConfig(
        host,
        port,
        broadcaster,
        parseBoolean(kv.get("secure"), true),
        chatRoom,
        token,
        broadcastId == null ? chatRoom : broadcastId,
        title == null ? "" : title,
        parseMemes(kv.get("memes")),
        intValue(kv, "queueCapacity", 1, 1_048_576),
        intValue(kv, "workers", 1, 64),
        Duration.ofSeconds(longValue(kv, "shutdownTimeoutSeconds", 1, 600)),
        Duration.ofSeconds(longValue(kv, "windowSeconds", 1, 3_600)),
        intValue(kv, "waveThreshold", 1, 100_000),
        intValue(kv, "hotMomentThreshold", 1, 100_000),
        Duration.ofSeconds(longValue(kv, "waveMinDurationSeconds", 0, 3_600)),
        Duration.ofSeconds(longValue(kv, "cooldownSeconds", 0, 86_400)),
        intValue(kv, "badgeCacheCapacity", 1, 65_536),
        intValue(kv, "maxRetries", 0, 100),
        Duration.ofMillis(backoffInitial),
        Duration.ofMillis(backoffMax),
        Duration.ofMillis(longValue(kv, "handshakeTimeoutMillis", 100, 300_000)),
        Duration.ofSeconds(longValue(kv, "pingIntervalSeconds", 1, 3_600)),
        parsePath("archiveDir", required(kv, "archiveDir")),
        parseZone(required(kv, "zone")),
        parseExporter(kv.get("metricsExporter")),
        parseEndpoint(kv.get("otelEndpoint")));
  }

  /**
   * Returns the chat server address.
   *
   * @return endpoint
   */
  public ChatEndpoint endpoint() {
    return new ChatEndpoint(host, port, broadcaster, secure);
  }

  /**
   * Returns the LIVE status announced when the watch starts.
   *
   * @param startedAt broadcast start
   * @return live status for this configuration
   */
  public BroadcastStatus liveStatus(Instant startedAt) {
    return BroadcastStatus.live(broadcastId, title, chatRoom, token, endpoint(), startedAt);
  }

  public DetectionSettings detectionSettings() {
    return new DetectionSettings(window, waveThreshold, hotMomentThreshold, waveMinDuration, cooldown);
  }

  public PipelineSettings pipelineSettings() {
    return new PipelineSettings(queueCapacity, workers, shutdownTimeout);
  }

  public RetryPolicy retryPolicy() {
    return new RetryPolicy(maxRetries, backoffInitial, RetryPolicy.DEFAULT_MULTIPLIER, backoffMax);
  }

  /**
   * Returns the memes to track.
   *
   * @return built-in catalog narrowed to {@link #memes()}, or the full catalog when none were named
   */
  public MemeCatalog catalog() {
    return memes.isEmpty() ? MemeCatalog.defaults() : MemeCatalog.defaults().select(memes);
  }

  @Override
  public String toString() {
    return "MonitorConfig[host=" + host + ", port=" + port + ", broadcaster=" + broadcaster
        + ", chatRoom=" + chatRoom + ", token=[REDACTED], broadcastId=" + broadcastId
        + ", archiveDirectory=" + archiveDirectory + "]";
  }

  private static String required(Map<String, String> kv, String key) {
    String value = kv.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static int intValue(Map<String, String> kv, String key, int min, int max) {
    return Math.toIntExact(Numbers.parseRange(key, required(kv, key), min, max));
  }

  private static long longValue(Map<String, String> kv, String key, long min, long max) {
    return Numbers.parseRange(key, required(kv, key), min, max);
  }

  static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("expected a boolean but was '" + value + "'");
    };
  }

  private static Set<String> parseMemes(String raw) {
    Set<String> keys = new LinkedHashSet<>();
    if (raw == null || raw.isBlank()) {
      return keys;
    }
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        keys.add(Strings.requireIdentifier("memes", token));
      }
    }
    if (!keys.isEmpty()) {
      MemeCatalog.defaults().select(keys);
    }
    return keys;
  }

  private static Path parsePath(String key, String raw) {
    String value = Strings.requireNonBlank(key, raw);
    if (value.equals("~") || value.startsWith("~/")) {
      value = System.getProperty("user.home") + value.substring(1);
    }
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static ZoneId parseZone(String raw) {
    try {
      return ZoneId.of(raw.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("zone is not a valid time zone: " + raw, ex);
    }
  }

  private static String parseEndpoint(String raw) {
    String value = Strings.optional("otelEndpoint", raw);
    if (value == null) {
      return null;
    }
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    return value;
  }

  private static String parseExporter(String raw) {
    if (raw == null || raw.isBlank()) {
      return "otlp";
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }
}
