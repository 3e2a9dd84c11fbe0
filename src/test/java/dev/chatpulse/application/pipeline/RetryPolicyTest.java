package dev.chatpulse.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void delaysDoubleUntilCapped() {
    RetryPolicy policy = RetryPolicy.defaults();

    assertEquals(1_000L, policy.delayMillis(1));
    assertEquals(2_000L, policy.delayMillis(2));
    assertEquals(16_000L, policy.delayMillis(5));
    assertEquals(30_000L, policy.delayMillis(6));
    assertEquals(30_000L, policy.delayMillis(40));
  }

  @Test
  void allowsExactlyMaxRetries() {
    RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(10), 1.5d, Duration.ofMillis(100));

    assertTrue(policy.allowsRetry(1));
    assertTrue(policy.allowsRetry(2));
    assertFalse(policy.allowsRetry(3));
    assertEquals(15L, policy.delayMillis(2));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(-1, Duration.ZERO, 2.0d, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ofSeconds(1), 0.5d, Duration.ofSeconds(2)));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ofSeconds(-1), 2.0d, Duration.ofSeconds(2)));
  }
}
