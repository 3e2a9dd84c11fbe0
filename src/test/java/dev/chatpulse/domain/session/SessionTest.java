package dev.chatpulse.domain.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.chatpulse.domain.chat.TransportState;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeCatalog;
import dev.chatpulse.domain.detect.MemeKind;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SessionTest {
  private static final Instant START = Instant.parse("2026-10-19T12:00:00Z");

  private final List<MemeKind> kinds = MemeCatalog.defaults().kinds();
  private final Session session = new Session("b-1", "Friday stream", START, kinds);

  @Test
  void snapshotListsEveryTrackedMemeInOrder() {
    SessionSnapshot snapshot = session.snapshot(SessionState.ACTIVE, TransportState.STREAMING, null);

    assertEquals(List.of("ji_chang", "sesin", "jjajang", "djrg", "sdn"), List.copyOf(snapshot.totals().keySet()));
    assertEquals(0, snapshot.totalMatches());
    assertNull(snapshot.lastDetectedAt());
    assertNull(snapshot.endedAt());
  }

  @Test
  void recordsMatchesWavesHotMomentsAndDonations() {
    MemeKind jiChang = kinds.get(0);
    session.recordMatch(jiChang, START.plusSeconds(1));
    session.recordMatch(jiChang, START.plusSeconds(3));
    session.recordMatch(kinds.get(4), START.plusSeconds(2));
    session.recordWave();
    session.recordHotMoment(HotMomentRecord.of(START.plusSeconds(3), jiChang, 20, 10));
    session.recordDonation(10);
    session.recordDonation(5);

    SessionSnapshot snapshot = session.snapshot(SessionState.ACTIVE, TransportState.STREAMING, null);
    assertEquals(2, snapshot.total("ji_chang"));
    assertEquals(1, snapshot.total("sdn"));
    assertEquals(3, snapshot.totalMatches());
    assertEquals(1, snapshot.waveCount());
    assertEquals(1L, snapshot.hotMomentCounts().get("ji_chang"));
    assertEquals("지창 burst: 20 occurrences in 10s", snapshot.hotMoments().get(0).description());
    assertEquals(2, snapshot.donationCount());
    assertEquals(15, snapshot.donationTotal());
    assertEquals(START.plusSeconds(3), snapshot.lastDetectedAt());
  }

  @Test
  void frozenSessionRejectsUpdatesAndKeepsFirstEndTime() {
    session.freeze(START.plusSeconds(60));
    session.freeze(START.plusSeconds(120));

    assertTrue(session.isFrozen());
    assertThrows(IllegalStateException.class, () -> session.recordWave());
    assertThrows(IllegalStateException.class, () -> session.recordDonation(1));
    assertEquals(START.plusSeconds(60),
        session.snapshot(SessionState.IDLE, TransportState.DISCONNECTED, null).endedAt());
  }

  @Test
  void snapshotIsDetachedFromLaterUpdates() {
    SessionSnapshot before = session.snapshot(SessionState.ACTIVE, TransportState.STREAMING, null);
    session.recordMatch(kinds.get(1), START.plusSeconds(1));

    assertEquals(0, before.total("sesin"));
    assertThrows(UnsupportedOperationException.class, () -> before.totals().put("sesin", 9L));
  }

  @Test
  void broadcastStatusRedactsTokenAndRequiresLiveFields() {
    ChatEndpoint endpoint = new ChatEndpoint("chat.example.net", 8001, "streamer01");
    BroadcastStatus live = BroadcastStatus.live("b-1", "title", "12345", "secret-token", endpoint, START);

    assertTrue(live.isLive());
    assertTrue(!live.toString().contains("secret-token"));
    assertEquals("wss://chat.example.net:8001/Websocket/streamer01", endpoint.uri().toString());
    assertThrows(RuntimeException.class,
        () -> BroadcastStatus.live("b-1", "title", "12345", null, endpoint, START));
  }
}
