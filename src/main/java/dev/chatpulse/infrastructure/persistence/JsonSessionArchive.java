package dev.chatpulse.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import dev.chatpulse.application.port.ClockPort;
import dev.chatpulse.application.port.SessionArchive;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.session.SessionSnapshot;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionArchive} that appends sessions to one JSON document per day.
 *
 * <p>The file is {@code <dir>/<yyyy-MM-dd>.json}, dated by the session start in the configured zone.
 * Document shape:</p>
 * <pre>{@code
 * {"date": "2026-10-19", "last_updated": "...",
 *  "sessions": [{"broadcast_title", "broadcast_id", "started_at", "ended_at", "saved_at",
 *                "wave_count", "donation_count", "donation_total",
 *                "totals": {key: n}, "hot_moment_counts": {key: n},
 *                "hot_moments": [{"time", "meme", "count", "description"}]}]}
 * }</pre>
 *
 * <p>Each store rewrites the whole document into a temporary file and moves it over the old one, so a
 * crash never leaves a half-written archive. Not safe for concurrent writers to the same directory.</p>
 *
 * @since 0.1.0
 */
public final class JsonSessionArchive implements SessionArchive {
  private static final Logger log = LoggerFactory.getLogger(JsonSessionArchive.class);

  private final Path directory;
  private final ZoneId zone;
  private final ClockPort clock;
  private final JsonFactory factory = new JsonFactory();
  private final JsonTreeReader reader = new JsonTreeReader(factory);

  /**
   * Creates an archive.
   *
   * @param directory target directory; created on first store
   * @param zone zone used to date sessions and format timestamps
   * @param clock source of {@code saved_at} and {@code last_updated}
   */
  public JsonSessionArchive(Path directory, ZoneId zone, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized void store(SessionSnapshot snapshot) throws IOException {
    Objects.requireNonNull(snapshot, "snapshot");
    LocalDate date = snapshot.startedAt().atZone(zone).toLocalDate();
    Path target = fileFor(date);
    Files.createDirectories(directory);
    List<Object> previous = readSessions(target);
    String now = format(Instant.ofEpochMilli(clock.nowMillis()));

    Path temp = Files.createTempFile(directory, date + "-", ".json.tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
        gen.useDefaultPrettyPrinter();
        gen.writeStartObject();
        gen.writeStringField("date", date.toString());
        gen.writeStringField("last_updated", now);
        gen.writeArrayFieldStart("sessions");
        for (Object session : previous) {
          JsonTreeReader.write(gen, session);
        }
        writeSession(gen, snapshot, now);
        gen.writeEndArray();
        gen.writeEndObject();
      }
      move(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.info("Archived session {} to {} ({} sessions that day)", snapshot.broadcastId(), target, previous.size() + 1);
  }

  /**
   * Returns the archive file for a date.
   *
   * @param date session date
   * @return {@code <dir>/<yyyy-MM-dd>.json}
   */
  public Path fileFor(LocalDate date) {
    return directory.resolve(DateTimeFormatter.ISO_LOCAL_DATE.format(date) + ".json");
  }

  private List<Object> readSessions(Path target) throws IOException {
    if (!Files.exists(target)) {
      return List.of();
    }
    Object root;
    try (InputStream in = Files.newInputStream(target)) {
      root = reader.read(in);
    }
    if (root instanceof Map<?, ?> map && map.get("sessions") instanceof List<?> sessions) {
      return new ArrayList<>(sessions);
    }
    throw new IOException("Archive " + target + " has no sessions array");
  }

  private void writeSession(JsonGenerator gen, SessionSnapshot snapshot, String savedAt) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("broadcast_title", snapshot.title());
    gen.writeStringField("broadcast_id", snapshot.broadcastId());
    gen.writeStringField("started_at", format(snapshot.startedAt()));
    if (snapshot.endedAt() != null) {
      gen.writeStringField("ended_at", format(snapshot.endedAt()));
    }
    gen.writeStringField("saved_at", savedAt);
    gen.writeNumberField("wave_count", snapshot.waveCount());
    gen.writeNumberField("donation_count", snapshot.donationCount());
    gen.writeNumberField("donation_total", snapshot.donationTotal());
    writeCounts(gen, "totals", snapshot.totals());
    writeCounts(gen, "hot_moment_counts", snapshot.hotMomentCounts());
    gen.writeArrayFieldStart("hot_moments");
    for (HotMomentRecord record : snapshot.hotMoments()) {
      gen.writeStartObject();
      gen.writeStringField("time", format(record.time()));
      gen.writeStringField("meme", record.memeKind().key());
      gen.writeNumberField("count", record.count());
      gen.writeStringField("description", record.description());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    if (snapshot.lastTransportError() != null) {
      gen.writeStringField("last_transport_error", snapshot.lastTransportError());
    }
    gen.writeEndObject();
  }

  private static void writeCounts(JsonGenerator gen, String field, Map<String, Long> counts) throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private String format(Instant instant) {
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atZone(zone));
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
