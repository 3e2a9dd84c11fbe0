package dev.chatpulse.application.pipeline;

import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.domain.chat.LiveEvent;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded FIFO hand-off between the reader thread and the detection workers.
 *
 * <p>{@link #put(LiveEvent)} blocks while the queue is full, which is the only backpressure point of the
 * pipeline; nothing is dropped. Depth, high-water mark, and enqueue wait are reported through
 * {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class IngestQueue {
  private final BlockingQueue<LiveEvent> queue;
  private final int capacity;
  private final MetricsPort metrics;
  private final AtomicInteger highWaterMark = new AtomicInteger();

  /**
   * Creates a queue.
   *
   * @param capacity maximum buffered events; must be positive
   * @param metrics metrics sink for {@code pipeline.queue.*}
   */
  public IngestQueue(int capacity, MetricsPort metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Enqueues an event, blocking while the queue is full.
   *
   * @param event decoded event
   * @throws InterruptedException if interrupted while waiting for space
   */
  public void put(LiveEvent event) throws InterruptedException {
    Objects.requireNonNull(event, "event");
    long startNanos = System.nanoTime();
    if (!queue.offer(event)) {
      metrics.increment("pipeline.queue.full");
      queue.put(event);
    }
    metrics.observe("pipeline.queue.enqueue.waitNanos", System.nanoTime() - startNanos);
    int depth = queue.size();
    metrics.observe("pipeline.queue.depth", depth);
    updateHighWater(depth);
  }

  /**
   * Takes the oldest event, waiting up to {@code timeout}.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return next event or {@code null} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public LiveEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }

  public int size() {
    return queue.size();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Returns the largest depth observed so far.
   *
   * @return high-water mark
   */
  public int highWaterMark() {
    return highWaterMark.get();
  }

  private void updateHighWater(int depth) {
    int previous;
    do {
      previous = highWaterMark.get();
      if (depth <= previous) {
        return;
      }
    } while (!highWaterMark.compareAndSet(previous, depth));
    metrics.observe("pipeline.queue.highWater", depth);
  }
}
