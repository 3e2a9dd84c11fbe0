package dev.chatpulse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.chatpulse.application.pipeline.RetryPolicy;
import dev.chatpulse.domain.detect.DetectionSettings;
import dev.chatpulse.domain.session.BroadcastStatus;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MonitorConfigTest {

  @Test
  void defaultsProduceStockSettings() {
    MonitorConfig config = MonitorConfig.fromMap(settings(Map.of()));

    assertEquals(DetectionSettings.defaults(), config.detectionSettings());
    assertEquals(RetryPolicy.defaults(), config.retryPolicy());
    assertEquals(3, config.pipelineSettings().workers());
    assertEquals(ZoneId.of("Asia/Seoul"), config.zone());
    assertEquals("otlp", config.metricsExporter());
    assertNull(config.otelEndpoint());
    assertTrue(config.secure());
    assertEquals(5, config.catalog().kinds().size());
    Path expectedArchive = Path.of(System.getProperty("user.home"), ".chatpulse", "sessions");
    assertEquals(expectedArchive.toAbsolutePath().normalize(), config.archiveDirectory());
  }

  @Test
  void broadcastIdDefaultsToChatRoom() {
    MonitorConfig config = MonitorConfig.fromMap(settings(Map.of("title", "Friday stream")));
    Instant start = Instant.parse("2026-03-01T12:00:00Z");

    BroadcastStatus status = config.liveStatus(start);

    assertEquals("12345", status.broadcastId());
    assertEquals("Friday stream", status.title());
    assertEquals("wss://chat.example.net:8001/Websocket/streamer01", status.endpoint().uri().toString());
    assertEquals(start, status.startedAt());
  }

  @Test
  void overridesAreApplied() {
    MonitorConfig config = MonitorConfig.fromMap(settings(Map.of(
        "secure", "false",
        "broadcastId", "b-77",
        "memes", "ji_chang, sdn",
        "windowSeconds", "15",
        "cooldownSeconds", "30",
        "backoffInitialMillis", "250",
        "backoffMaxMillis", "4000",
        "archiveDir", "/var/lib/chatpulse/../chatpulse",
        "zone", "UTC")));

    assertFalse(config.secure());
    assertEquals("b-77", config.broadcastId());
    assertEquals(Set.of("ji_chang", "sdn"), config.memes());
    assertEquals(List.of("ji_chang", "sdn"),
        config.catalog().kinds().stream().map(kind -> kind.key()).toList());
    assertEquals(Duration.ofSeconds(15), config.detectionSettings().window());
    assertEquals(Duration.ofSeconds(30), config.detectionSettings().cooldown());
    assertEquals(250L, config.retryPolicy().delayMillis(1));
    assertEquals(4_000L, config.retryPolicy().delayMillis(10));
    assertEquals(Path.of("/var/lib/chatpulse").toAbsolutePath(), config.archiveDirectory());
    assertEquals(ZoneId.of("UTC"), config.zone());
    assertTrue(config.endpoint().uri().toString().startsWith("ws://"));
  }

  @Test
  void missingConnectionKeysAreRejected() {
    Map<String, String> kv = settings(Map.of());
    kv.remove("token");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(kv));
    assertEquals("token is required", ex.getMessage());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(settings(Map.of("port", "0"))));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(settings(Map.of("host", "bad host"))));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(settings(Map.of("memes", "unknown"))));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(settings(Map.of("zone", "Mars/Base"))));
    assertThrows(IllegalArgumentException.class,
        () -> MonitorConfig.fromMap(settings(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> MonitorConfig.fromMap(settings(Map.of("otelEndpoint", "grpc://collector:4317"))));
    assertThrows(IllegalArgumentException.class,
        () -> MonitorConfig.fromMap(settings(Map.of("secure", "maybe"))));
    assertThrows(IllegalArgumentException.class,
        () -> MonitorConfig.fromMap(settings(Map.of("backoffInitialMillis", "5000", "backoffMaxMillis", "1000"))));
  }

  @Test
  void toStringRedactsToken() {
    MonitorConfig config = MonitorConfig.fromMap(settings(Map.of()));

    assertFalse(config.toString().contains("room-token"));
    assertTrue(config.toString().contains("[REDACTED]"));
  }

  @Test
  void parseBooleanFallsBackOnBlank() {
    assertTrue(MonitorConfig.parseBoolean(" ", true));
    assertFalse(MonitorConfig.parseBoolean("no", true));
  }

  private static Map<String, String> settings(Map<String, String> overrides) {
    Map<String, String> kv = new HashMap<>(MonitorDefaults.asFlatMap());
    kv.put("host", "chat.example.net");
    kv.put("port", "8001");
    kv.put("broadcaster", "streamer01");
    kv.put("chatRoom", "12345");
    kv.put("token", "room-token");
    kv.putAll(overrides);
    return kv;
  }
}
