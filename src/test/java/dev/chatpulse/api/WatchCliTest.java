package dev.chatpulse.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.chatpulse.domain.chat.TransportState;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeKind;
import dev.chatpulse.domain.session.SessionSnapshot;
import dev.chatpulse.domain.session.SessionState;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class WatchCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(WatchCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = WatchCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("chatpulse watch: live chat meme monitor"));
  }

  @Test
  void dryRunPrintsPlanWithoutConnecting() {
    ExitCode code = WatchCli.run(new String[] {
        "host=chat.example.net",
        "port=8001",
        "broadcaster=streamer01",
        "chatRoom=12345",
        "token=room-token",
        "memes=sdn",
        "archiveDir=" + tempDir.resolve("archive"),
        "metricsExporter=none",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.startsWith("Watch dry-run: no connection will be opened."));
    assertTrue(output.contains("wss://chat.example.net:8001/Websocket/streamer01"));
    assertTrue(output.contains(" Memes            : sdn"));
    assertFalse(output.contains("room-token"));
    assertFalse(Files.exists(tempDir.resolve("archive")));
  }

  @Test
  void dryRunReadsYamlAndCliWins() throws URISyntaxException {
    Path yaml = Path.of(WatchCliTest.class.getResource("/watch-config.yaml").toURI());

    ExitCode code = WatchCli.run(new String[] {"config=" + yaml, "port=9001", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("wss://chat.example.net:9001/Websocket/streamer01"));
    assertTrue(output.contains("12345 (Friday stream)"));
    assertTrue(output.contains("ji_chang, sdn"));
    assertTrue(output.contains("10s / 30s"));
    assertTrue(hasLogContaining("CLI overrides YAML for key: port"));
  }

  @Test
  void missingRequiredKeyIsInvalidArgs() {
    ExitCode code = WatchCli.run(new String[] {"host=chat.example.net", "port=8001", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: watch"));
    assertTrue(hasLogContaining("broadcaster is required"));
  }

  @Test
  void malformedArgumentIsInvalidArgs() {
    ExitCode code = WatchCli.run(new String[] {"host"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("argument must be key=value"));
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = WatchCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasLogContaining("Config file not found"));
  }

  @Test
  void malformedConfigFileIsConfigError() throws Exception {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "watch: [unclosed\n");

    ExitCode code = WatchCli.run(new String[] {"config=" + yaml, "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void summaryListsTotalsAndHotMoments() {
    MemeKind jiChang = MemeKind.of("ji_chang", "지창", "지창");
    Instant start = Instant.parse("2026-03-01T12:00:00Z");
    Map<String, Long> totals = new LinkedHashMap<>();
    totals.put("ji_chang", 25L);
    totals.put("sdn", 0L);
    SessionSnapshot snapshot = new SessionSnapshot(
        "b-1", "Friday stream", start, start.plusSeconds(600), totals, 1L, Map.of("ji_chang", 1L),
        List.of(HotMomentRecord.of(start.plusSeconds(30), jiChang, 20, 10)), 2L, 150L, start.plusSeconds(30),
        SessionState.IDLE, TransportState.DISCONNECTED, "connection reset");

    List<String> lines = WatchCli.summaryLines(snapshot);

    assertEquals("Session summary for broadcast b-1 (Friday stream)", lines.get(0));
    assertTrue(lines.contains(" ji_chang         : 25 matches, 1 hot moments"));
    assertTrue(lines.contains(" sdn              : 0 matches, 0 hot moments"));
    assertTrue(lines.contains(" Waves            : 1"));
    assertTrue(lines.contains(" Donations        : 2 (150 total)"));
    assertTrue(lines.contains("  - 2026-03-01T12:00:30Z 지창 x20"));
    assertEquals(" Last error       : connection reset", lines.get(lines.size() - 1));
  }

  private boolean hasLogContaining(String text) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(text));
  }
}
