package dev.chatpulse.domain.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SlidingWindowTest {

  @Test
  void keepsEntriesWithinTrailingWindow() {
    SlidingWindow window = new SlidingWindow(10_000);
    assertEquals(1, window.record(0));
    assertEquals(2, window.record(5_000));
    assertEquals(3, window.record(10_000));
    assertEquals(3, window.record(10_000));
    assertEquals(3, window.record(10_001));
    assertEquals(5_000, window.oldest());
  }

  @Test
  void clampsAppendsToNewestEntry() {
    SlidingWindow window = new SlidingWindow(10_000);
    window.record(5_000);
    assertEquals(5_000, window.append(4_000));
    assertEquals(5_000, window.clamp(3_000));
    assertEquals(6_000, window.clamp(6_000));
    assertEquals(2, window.size());
  }

  @Test
  void emptyWindowReportsNoOldestEntry() {
    SlidingWindow window = new SlidingWindow(1_000);
    assertTrue(window.isEmpty());
    assertEquals(Long.MIN_VALUE, window.oldest());
    window.record(100);
    window.clear();
    assertTrue(window.isEmpty());
  }

  @Test
  void rejectsNonPositiveLength() {
    assertThrows(IllegalArgumentException.class, () -> new SlidingWindow(0));
  }
}
