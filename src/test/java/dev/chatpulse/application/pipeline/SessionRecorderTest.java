package dev.chatpulse.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.chat.TransportState;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeCatalog;
import dev.chatpulse.domain.detect.MemeKind;
import dev.chatpulse.domain.detect.WaveEvent;
import dev.chatpulse.domain.session.Session;
import dev.chatpulse.domain.session.SessionSnapshot;
import dev.chatpulse.domain.session.SessionState;
import dev.chatpulse.testutil.RecordingMetricsPort;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class SessionRecorderTest {
  private static final Instant START = Instant.parse("2026-10-19T12:00:00Z");

  private final List<MemeKind> kinds = MemeCatalog.defaults().kinds();
  private final Session session = new Session("b-1", "Friday stream", START, kinds);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<HotMomentRecord> announced = new CopyOnWriteArrayList<>();
  private final SessionRecorder recorder = new SessionRecorder(session, announced::add, metrics);

  @Test
  void appliesResultsToOpenSession() {
    MemeKind jiChang = kinds.get(0);
    HotMomentRecord moment = HotMomentRecord.of(START.plusSeconds(5), jiChang, 20, 10);

    recorder.onMemeMatched(jiChang, START.plusSeconds(1));
    recorder.onWave(new WaveEvent(START.plusSeconds(2), 20));
    recorder.onHotMoment(moment);
    recorder.onDonation(new DonationEvent("fan", 7));

    SessionSnapshot snapshot = session.snapshot(SessionState.ACTIVE, TransportState.STREAMING, null);
    assertEquals(1L, snapshot.total("ji_chang"));
    assertEquals(1L, snapshot.waveCount());
    assertEquals(7L, snapshot.donationTotal());
    assertEquals(List.of(moment), announced);
    assertEquals(0, metrics.count("session.updates.afterFreeze"));
  }

  @Test
  void lateResultsAfterFreezeAreDroppedAndCounted() {
    MemeKind jiChang = kinds.get(0);
    session.freeze(START.plusSeconds(60));

    recorder.onMemeMatched(jiChang, START.plusSeconds(61));
    recorder.onWave(new WaveEvent(START.plusSeconds(61), 20));
    recorder.onHotMoment(HotMomentRecord.of(START.plusSeconds(61), jiChang, 20, 10));
    recorder.onDonation(new DonationEvent("fan", 7));

    SessionSnapshot snapshot = session.snapshot(SessionState.IDLE, TransportState.DISCONNECTED, null);
    assertEquals(0L, snapshot.totalMatches());
    assertEquals(0L, snapshot.waveCount());
    assertEquals(0L, snapshot.donationCount());
    assertTrue(snapshot.hotMoments().isEmpty());
    assertTrue(announced.isEmpty());
    assertEquals(4, metrics.count("session.updates.afterFreeze"));
  }
}
