package dev.chatpulse.api;

import dev.chatpulse.application.pipeline.SessionManager;
import dev.chatpulse.config.CompositionRoot;
import dev.chatpulse.config.ConfigMerger;
import dev.chatpulse.config.MonitorConfig;
import dev.chatpulse.config.MonitorDefaults;
import dev.chatpulse.config.YamlConfigLoader;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeKind;
import dev.chatpulse.domain.session.BroadcastStatus;
import dev.chatpulse.domain.session.SessionSnapshot;
import dev.chatpulse.domain.session.SessionState;
import dev.chatpulse.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins one broadcast chat room and tracks memes until the JVM is stopped or the server stays
 * unreachable.
 *
 * <p>Announces the broadcast as LIVE on start and OFFLINE from a shutdown hook, so Ctrl-C closes the
 * session, drains the queue, and archives it before the process exits.</p>
 *
 * @since 0.1.0
 */
public final class WatchCli {
  private static final Logger log = LoggerFactory.getLogger(WatchCli.class);
  private static final long POLL_MILLIS = 500;
  private static final String SUMMARY_USAGE =
      "usage: watch host=<host> port=<port> broadcaster=<id> chatRoom=<room> token=<token> "
          + "[broadcastId=ID] [title=TEXT] [config=FILE.yaml] [secure=true|false] [memes=k1,k2] "
          + "[windowSeconds=N] [waveThreshold=N] [hotMomentThreshold=N] [cooldownSeconds=N] "
          + "[workers=1-64] [queueCapacity=N] [maxRetries=N] [archiveDir=PATH] [zone=ZONE] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      chatpulse watch: live chat meme monitor

      Usage:
        watch host=<host> port=<port> broadcaster=<id> chatRoom=<room> token=<token> [options]

      Required (command line or YAML):
        host=HOST                 Chat server host
        port=1-65535              Chat server port
        broadcaster=ID            Broadcaster id in the WebSocket path
        chatRoom=ROOM             Chat room number sent in JOIN
        token=TOKEN               Room entry token sent in JOIN (never logged)

      Optional:
        config=FILE.yaml          YAML file; 'common' and 'watch' sections, CLI wins over YAML
        broadcastId=ID            Broadcast id recorded with the session (default chatRoom)
        title=TEXT                Broadcast title recorded with the session
        secure=true|false         wss (default) or ws
        memes=KEY,...             Subset of ji_chang,sesin,jjajang,djrg,sdn (default all)
        windowSeconds=N           Detection window (default 10)
        waveThreshold=N           Matches for a wave (default 20)
        hotMomentThreshold=N      Matches of one meme for a hot moment (default 20)
        waveMinDurationSeconds=N  Minimum wave span (default 10)
        cooldownSeconds=N         Spacing between triggers (default 60)
        workers=1-64              Detection workers (default 3)
        queueCapacity=N           Ingest queue bound (default 1024)
        maxRetries=N              Reconnects before giving up (default 5)
        backoffInitialMillis=N    First reconnect delay (default 1000)
        backoffMaxMillis=N        Reconnect delay cap (default 30000)
        archiveDir=PATH           Daily JSON archives (default ~/.chatpulse/sessions)
        zone=ZONE                 Zone used to date sessions (default Asia/Seoul)
        metricsExporter=otlp|none Metrics exporter (default otlp)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        --dry-run                 Validate settings and print the plan without connecting
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private WatchCli() {}

  /**
   * Runs the command.
   *
   * @param args arguments after {@code watch}
   * @return exit status
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for watch");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MonitorConfig config;
    try {
      config = resolveConfig(kv);
    } catch (ConfigFileException ex) {
      log.error("{}", ex.getMessage(), ex.getCause());
      return ex.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid watch configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      return watch(root);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Watch interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while watching broadcast {}", config.broadcastId(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static MonitorConfig resolveConfig(Map<String, String> kv) throws ConfigFileException {
    String configPath = kv.remove("config");
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null && !configPath.isBlank()) {
      Path path;
      try {
        path = Path.of(configPath.trim());
      } catch (InvalidPathException ex) {
        throw new ConfigFileException("config is not a valid path: " + configPath, ExitCode.INVALID_ARGS, ex);
      }
      try {
        yaml = YamlConfigLoader.load(path, "watch");
      } catch (IOException ex) {
        throw new ConfigFileException("Unable to read config file " + path, ExitCode.IO_ERROR, ex);
      } catch (IllegalArgumentException ex) {
        throw new ConfigFileException(ex.getMessage(), ExitCode.CONFIG_ERROR, ex);
      }
      if (yaml.isEmpty()) {
        throw new ConfigFileException("Config file not found: " + path, ExitCode.CONFIG_ERROR, null);
      }
      log.info("Loaded watch settings from {}", path);
    }
    Map<String, String> effective =
        ConfigMerger.buildEffectiveConfig(yaml, kv, MonitorDefaults.asFlatMap(), log::warn);
    return MonitorConfig.fromMap(effective);
  }

  private static ExitCode watch(CompositionRoot root) throws InterruptedException {
    SessionManager manager = root.sessionManager();
    MonitorConfig config = root.config();
    Consumer<HotMomentRecord> announcer =
        record -> CliPrinter.println("[hot moment] " + record.time() + " " + record.description());
    manager.addHotMomentListener(announcer);

    CountDownLatch shutdownRequested = new CountDownLatch(1);
    CountDownLatch shutdownComplete = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      shutdownRequested.countDown();
      try {
        log.info("Shutdown requested; closing session for broadcast {}", config.broadcastId());
        manager.onStatus(BroadcastStatus.offline());
        root.close();
      } finally {
        shutdownComplete.countDown();
      }
    }, "chatpulse-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    log.info("Watching broadcast {} at {}", config.broadcastId(), config.endpoint().uri());
    manager.onStatus(config.liveStatus(Instant.now()));
    while (manager.state() != SessionState.IDLE) {
      if (shutdownRequested.await(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        break;
      }
    }

    if (shutdownRequested.getCount() == 0) {
      shutdownComplete.await();
    } else {
      removeHook(hook);
      manager.onStatus(BroadcastStatus.offline());
    }
    manager.removeHotMomentListener(announcer);

    Optional<SessionSnapshot> snapshot = manager.snapshot();
    snapshot.ifPresent(s -> CliPrinter.printLines(summaryLines(s).toArray(String[]::new)));
    boolean gaveUp = shutdownRequested.getCount() != 0
        && snapshot.map(SessionSnapshot::lastTransportError).isPresent();
    if (gaveUp) {
      log.error("Gave up on broadcast {}: {}", config.broadcastId(), snapshot.get().lastTransportError());
      return ExitCode.IO_ERROR;
    }
    return ExitCode.SUCCESS;
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered", ex);
    }
  }

  static List<String> summaryLines(SessionSnapshot snapshot) {
    List<String> lines = new ArrayList<>();
    lines.add("Session summary for broadcast " + snapshot.broadcastId()
        + (snapshot.title().isEmpty() ? "" : " (" + snapshot.title() + ")"));
    lines.add(" Started          : " + snapshot.startedAt());
    lines.add(" Ended            : " + (snapshot.endedAt() == null ? "<running>" : snapshot.endedAt()));
    for (Map.Entry<String, Long> total : snapshot.totals().entrySet()) {
      lines.add(String.format(Locale.ROOT, " %-16s : %d matches, %d hot moments",
          total.getKey(), total.getValue(), snapshot.hotMomentCounts().getOrDefault(total.getKey(), 0L)));
    }
    lines.add(" Waves            : " + snapshot.waveCount());
    lines.add(" Donations        : " + snapshot.donationCount() + " (" + snapshot.donationTotal() + " total)");
    for (HotMomentRecord record : snapshot.hotMoments()) {
      MemeKind kind = record.memeKind();
      lines.add("  - " + record.time() + " " + kind.displayName() + " x" + record.count());
    }
    if (snapshot.lastTransportError() != null) {
      lines.add(" Last error       : " + snapshot.lastTransportError());
    }
    return lines;
  }

  private static void printDryRunPlan(MonitorConfig config) {
    CliPrinter.printLines(
        "Watch dry-run: no connection will be opened.",
        " Endpoint         : " + config.endpoint().uri(),
        " Chat room        : " + config.chatRoom(),
        " Broadcast        : " + config.broadcastId() + (config.title().isEmpty() ? "" : " (" + config.title() + ")"),
        " Memes            : " + String.join(", ",
            config.catalog().kinds().stream().map(MemeKind::key).toList()),
        " Window / cooldown: " + config.window().toSeconds() + "s / " + config.cooldown().toSeconds() + "s",
        " Thresholds       : wave " + config.waveThreshold() + " (min " + config.waveMinDuration().toSeconds()
            + "s), hot moment " + config.hotMomentThreshold(),
        " Workers / queue  : " + config.workers() + " / " + config.queueCapacity(),
        " Retries          : " + config.maxRetries() + " (" + config.backoffInitial().toMillis() + "ms.."
            + config.backoffMax().toMillis() + "ms)",
        " Archive          : " + config.archiveDirectory() + " (" + config.zone() + ")",
        " Metrics          : " + config.metricsExporter(),
        " Re-run without --dry-run to start watching.");
  }

  static final class ConfigFileException extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    ConfigFileException(String message, ExitCode exitCode, Throwable cause) {
      super(message, cause);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
