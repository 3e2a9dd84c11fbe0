package dev.chatpulse.domain.session;

import dev.chatpulse.domain.chat.TransportState;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeKind;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Running tally for one live broadcast.
 *
 * <p>All mutators and {@link #snapshot} synchronize on the instance, so a snapshot never observes a
 * half-applied update. After {@link #freeze(Instant)} every mutator throws {@link IllegalStateException}.</p>
 *
 * @since 0.1.0
 */
public final class Session {
  private final String broadcastId;
  private final String title;
  private final Instant startedAt;
  private final Map<String, Long> totals = new LinkedHashMap<>();
  private final Map<String, Long> hotMomentCounts = new LinkedHashMap<>();
  private final List<HotMomentRecord> hotMoments = new ArrayList<>();
  private long waveCount;
  private long donationCount;
  private long donationTotal;
  private Instant lastDetectedAt;
  private Instant endedAt;

  /**
   * Opens a session.
   *
   * @param broadcastId broadcast number
   * @param title broadcast title
   * @param startedAt session start
   * @param kinds tracked memes; totals start at zero in this order
   */
  public Session(String broadcastId, String title, Instant startedAt, List<MemeKind> kinds) {
    this.broadcastId = Objects.requireNonNull(broadcastId, "broadcastId");
    this.title = Objects.requireNonNullElse(title, "");
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    for (MemeKind kind : kinds) {
      totals.put(kind.key(), 0L);
      hotMomentCounts.put(kind.key(), 0L);
    }
  }

  public String broadcastId() {
    return broadcastId;
  }

  public String title() {
    return title;
  }

  public Instant startedAt() {
    return startedAt;
  }

  /**
   * Counts one match of {@code kind}.
   *
   * @param kind matched meme
   * @param at match time
   */
  public synchronized void recordMatch(MemeKind kind, Instant at) {
    ensureOpen();
    totals.merge(kind.key(), 1L, Long::sum);
    if (lastDetectedAt == null || at.isAfter(lastDetectedAt)) {
      lastDetectedAt = at;
    }
  }

  /** Counts one wave. */
  public synchronized void recordWave() {
    ensureOpen();
    waveCount++;
  }

  /**
   * Appends a hot moment and bumps its meme's counter.
   *
   * @param record completed hot moment
   */
  public synchronized void recordHotMoment(HotMomentRecord record) {
    ensureOpen();
    hotMoments.add(record);
    hotMomentCounts.merge(record.memeKind().key(), 1L, Long::sum);
  }

  /**
   * Adds a donation to the tally.
   *
   * @param count donated stars
   */
  public synchronized void recordDonation(int count) {
    ensureOpen();
    donationCount++;
    donationTotal += count;
  }

  /**
   * Closes the session to further updates. Repeated calls keep the first end time.
   *
   * @param at session end
   */
  public synchronized void freeze(Instant at) {
    if (endedAt == null) {
      endedAt = Objects.requireNonNull(at, "at");
    }
  }

  public synchronized boolean isFrozen() {
    return endedAt != null;
  }

  /**
   * Copies the current tally.
   *
   * @param state session-owner state to report
   * @param transportState transport phase to report
   * @param lastTransportError last transport failure; may be {@code null}
   * @return immutable snapshot
   */
  public synchronized SessionSnapshot snapshot(
      SessionState state, TransportState transportState, String lastTransportError) {
    return new SessionSnapshot(
        broadcastId,
        title,
        startedAt,
        endedAt,
        new LinkedHashMap<>(totals),
        waveCount,
        new LinkedHashMap<>(hotMomentCounts),
        new ArrayList<>(hotMoments),
        donationCount,
        donationTotal,
        lastDetectedAt,
        state,
        transportState,
        lastTransportError);
  }

  private void ensureOpen() {
    if (endedAt != null) {
      throw new IllegalStateException("session " + broadcastId + " is frozen");
    }
  }
}
