package dev.chatpulse.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.chat.LiveEvent;
import dev.chatpulse.testutil.RecordingMetricsPort;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class IngestQueueTest {

  @Test
  void putBlocksWhileFullUntilSpaceFrees() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    IngestQueue queue = new IngestQueue(1, metrics);
    LiveEvent first = new DonationEvent("a", 1);
    LiveEvent second = new DonationEvent("b", 2);
    queue.put(first);

    CountDownLatch putDone = new CountDownLatch(1);
    Thread producer = new Thread(() -> {
      try {
        queue.put(second);
        putDone.countDown();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    producer.start();

    assertFalse(putDone.await(200, TimeUnit.MILLISECONDS), "put must block while the queue is full");
    assertSame(first, queue.poll(1, TimeUnit.SECONDS));
    assertTrue(putDone.await(2, TimeUnit.SECONDS));
    assertSame(second, queue.poll(1, TimeUnit.SECONDS));
    producer.join(2_000);

    assertEquals(1, metrics.count("pipeline.queue.full"));
    assertEquals(1, queue.highWaterMark());
  }

  @Test
  void blockedPutIsInterruptible() throws Exception {
    IngestQueue queue = new IngestQueue(1, new RecordingMetricsPort());
    queue.put(new DonationEvent("a", 1));
    CountDownLatch interrupted = new CountDownLatch(1);
    Thread producer = new Thread(() -> {
      try {
        queue.put(new DonationEvent("b", 2));
      } catch (InterruptedException ex) {
        interrupted.countDown();
      }
    });
    producer.start();
    Thread.sleep(100);
    producer.interrupt();

    assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    assertEquals(1, queue.size());
  }

  @Test
  void recordsDepthObservations() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    IngestQueue queue = new IngestQueue(8, metrics);
    for (int i = 0; i < 3; i++) {
      queue.put(new DonationEvent("a", i));
    }

    assertEquals(List.of(1L, 2L, 3L), metrics.observed("pipeline.queue.depth"));
    assertEquals(3, queue.highWaterMark());
    assertEquals(8, queue.capacity());
  }
}
