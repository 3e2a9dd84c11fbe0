package dev.chatpulse.application.pipeline;

import dev.chatpulse.application.port.DetectionListener;
import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeKind;
import dev.chatpulse.domain.detect.WaveEvent;
import dev.chatpulse.domain.session.Session;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies detector results to the live {@link Session}.
 *
 * <p>A worker that outlives the drain timeout can still report after the session was frozen; such
 * updates are dropped, logged, and counted as {@code session.updates.afterFreeze}. The frozen check and
 * the update run under the session's own monitor, so {@link Session#freeze(Instant)} cannot slip in
 * between them.</p>
 */
final class SessionRecorder implements DetectionListener {
  private static final Logger log = LoggerFactory.getLogger(SessionRecorder.class);

  private final Session session;
  private final Consumer<HotMomentRecord> hotMoments;
  private final MetricsPort metrics;

  SessionRecorder(Session session, Consumer<HotMomentRecord> hotMoments, MetricsPort metrics) {
    this.session = Objects.requireNonNull(session, "session");
    this.hotMoments = Objects.requireNonNull(hotMoments, "hotMoments");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void onMemeMatched(MemeKind kind, Instant at) {
    apply("match", () -> session.recordMatch(kind, at));
  }

  @Override
  public void onWave(WaveEvent event) {
    apply("wave", session::recordWave);
  }

  @Override
  public void onHotMoment(HotMomentRecord record) {
    if (apply("hot moment", () -> session.recordHotMoment(record))) {
      hotMoments.accept(record);
    }
  }

  @Override
  public void onDonation(DonationEvent event) {
    apply("donation", () -> session.recordDonation(event.count()));
  }

  private boolean apply(String what, Runnable update) {
    synchronized (session) {
      if (!session.isFrozen()) {
        update.run();
        return true;
      }
    }
    metrics.increment("session.updates.afterFreeze");
    log.warn("Dropped {} for broadcast {}: session already frozen", what, session.broadcastId());
    return false;
  }
}
