package dev.chatpulse.domain.session;

import dev.chatpulse.domain.chat.TransportState;
import dev.chatpulse.domain.detect.HotMomentRecord;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable point-in-time copy of a {@link Session} plus the pipeline state around it.
 *
 * @param broadcastId broadcast number
 * @param title broadcast title
 * @param startedAt session start
 * @param endedAt session end, {@code null} while the session is open
 * @param totals matches per meme key, in catalog order
 * @param waveCount number of waves fired
 * @param hotMomentCounts hot moments per meme key, in catalog order
 * @param hotMoments completed hot moments in trigger order
 * @param donationCount number of donations received
 * @param donationTotal sum of donated stars
 * @param lastDetectedAt time of the most recent meme match, {@code null} when none
 * @param state session-owner lifecycle state at snapshot time
 * @param transportState transport phase at snapshot time
 * @param lastTransportError last transport failure message, {@code null} when none
 * @since 0.1.0
 */
public record SessionSnapshot(
    String broadcastId,
    String title,
    Instant startedAt,
    Instant endedAt,
    Map<String, Long> totals,
    long waveCount,
    Map<String, Long> hotMomentCounts,
    List<HotMomentRecord> hotMoments,
    long donationCount,
    long donationTotal,
    Instant lastDetectedAt,
    SessionState state,
    TransportState transportState,
    String lastTransportError) {

  /** Freezes the collections. */
  public SessionSnapshot {
    Objects.requireNonNull(broadcastId, "broadcastId");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(transportState, "transportState");
    title = Objects.requireNonNullElse(title, "");
    totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
    hotMomentCounts = Collections.unmodifiableMap(new LinkedHashMap<>(hotMomentCounts));
    hotMoments = List.copyOf(hotMoments);
  }

  /**
   * Returns a copy with a different lifecycle and transport view.
   *
   * @param newState lifecycle state
   * @param newTransportState transport phase
   * @param error last transport error; may be {@code null}
   * @return updated snapshot
   */
  public SessionSnapshot withPipeline(SessionState newState, TransportState newTransportState, String error) {
    return new SessionSnapshot(
        broadcastId, title, startedAt, endedAt, totals, waveCount, hotMomentCounts, hotMoments,
        donationCount, donationTotal, lastDetectedAt, newState, newTransportState, error);
  }

  /**
   * Returns the total for one meme key.
   *
   * @param key meme key
   * @return matches so far, 0 for unknown keys
   */
  public long total(String key) {
    return totals.getOrDefault(key, 0L);
  }

  /**
   * Sums the per-meme totals.
   *
   * @return total matches across all memes
   */
  public long totalMatches() {
    long sum = 0;
    for (long value : totals.values()) {
      sum += value;
    }
    return sum;
  }
}
