package dev.chatpulse.domain.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CooldownGateTest {

  @Test
  void firstClaimAlwaysSucceeds() {
    CooldownGate gate = new CooldownGate(60_000);
    assertFalse(gate.coolingDown(Long.MIN_VALUE + 1));
    assertTrue(gate.tryClaim(0));
    assertEquals(0, gate.lastTriggerAt());
  }

  @Test
  void suppressesUntilCooldownElapsed() {
    CooldownGate gate = new CooldownGate(60_000);
    assertTrue(gate.tryClaim(1_000));
    assertFalse(gate.tryClaim(60_999));
    assertTrue(gate.coolingDown(60_999));
    assertTrue(gate.tryClaim(61_000));
    assertEquals(61_000, gate.lastTriggerAt());
  }

  @Test
  void exactlyOneConcurrentClaimWins() throws Exception {
    CooldownGate gate = new CooldownGate(60_000);
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          return gate.tryClaim(5_000);
        }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(5, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertEquals(1, winners);
    } finally {
      executor.shutdownNow();
    }
  }
}
