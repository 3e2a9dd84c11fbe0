package dev.chatpulse.application.pipeline;

import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.domain.chat.LiveEvent;
import dev.chatpulse.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Fixed set of detection workers draining an {@link IngestQueue}.
 *
 * <p>Each worker loops {@code poll -> handler} until a stop is requested and the queue is empty, so
 * {@link #shutdown(Duration)} drains every buffered event before the threads exit. The first handler
 * failure is recorded, stops all workers, and is reported to the failure callback; the pool is not
 * restartable.</p>
 *
 * @since 0.1.0
 */
public final class WorkerPool {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
  private static final long WORKER_IDLE_POLL_MILLIS = 25L;

  private final IngestQueue queue;
  private final Consumer<LiveEvent> handler;
  private final int workerCount;
  private final String threadPrefix;
  private final MetricsPort metrics;
  private final Consumer<Exception> onFailure;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicReference<Exception> failure = new AtomicReference<>();

  private volatile ExecutorService executor;

  /**
   * Creates a pool; call {@link #start()} to launch the workers.
   *
   * @param queue source queue
   * @param handler event consumer, normally {@link PatternDetector#onEvent(LiveEvent)}
   * @param workerCount number of workers; must be positive
   * @param threadPrefix worker thread-name prefix
   * @param metrics metrics sink for {@code pipeline.worker.*}
   * @param onFailure callback invoked once with the first worker failure; may be {@code null}
   */
  public WorkerPool(
      IngestQueue queue,
      Consumer<LiveEvent> handler,
      int workerCount,
      String threadPrefix,
      MetricsPort metrics,
      Consumer<Exception> onFailure) {
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive (was " + workerCount + ")");
    }
    this.queue = Objects.requireNonNull(queue, "queue");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.workerCount = workerCount;
    this.threadPrefix = Objects.requireNonNull(threadPrefix, "threadPrefix");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.onFailure = onFailure != null ? onFailure : ex -> { };
  }

  /**
   * Launches the workers.
   *
   * @throws IllegalStateException if the pool was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("worker pool already started");
    }
    ExecutorService pool = ExecutorFactories.newWorkerPool(workerCount, threadPrefix, this::handleCrash);
    executor = pool;
    for (int i = 0; i < workerCount; i++) {
      pool.execute(new Worker());
    }
    metrics.observe("pipeline.worker.active", workerCount);
    log.debug("Started {} detection workers ({})", workerCount, threadPrefix);
  }

  /**
   * Requests a stop, waits for the workers to drain the queue, and forces termination after
   * {@code timeout}.
   *
   * @param timeout maximum wait before interrupting the workers
   * @return {@code true} when every worker exited within the timeout
   */
  public boolean shutdown(Duration timeout) {
    stopRequested.set(true);
    ExecutorService pool = executor;
    if (pool == null) {
      return true;
    }
    pool.shutdown();
    boolean terminated = false;
    try {
      terminated = pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        metrics.increment("pipeline.worker.shutdown.force");
        log.warn("Detection workers active after {} ms; forcing shutdown ({} events left)",
            timeout.toMillis(), queue.size());
        pool.shutdownNow();
        terminated = pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      metrics.increment("pipeline.worker.shutdown.interrupted");
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Detection workers failed to terminate cleanly");
    }
    metrics.observe("pipeline.worker.active", 0);
    metrics.observe("pipeline.queue.highWater", queue.highWaterMark());
    return terminated;
  }

  /**
   * Returns the first worker failure.
   *
   * @return failure, or empty while the workers are healthy
   */
  public Optional<Exception> failure() {
    return Optional.ofNullable(failure.get());
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      MDC.put("pipeline", threadPrefix);
      try {
        while (true) {
          if (failure.get() != null) {
            break;
          }
          if (stopRequested.get() && queue.isEmpty()) {
            break;
          }
          LiveEvent event = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (event == null) {
            continue;
          }
          try {
            handler.accept(event);
            metrics.increment("pipeline.events.processed");
          } catch (RuntimeException ex) {
            signalFailure(ex);
            break;
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!stopRequested.get()) {
          metrics.increment("pipeline.worker.interrupted");
        }
      } finally {
        MDC.remove("pipeline");
      }
    }
  }

  private void handleCrash(Thread thread, Throwable throwable) {
    metrics.increment("pipeline.worker.uncaught");
    log.error("Detection worker {} threw an uncaught exception", thread.getName(), throwable);
    signalFailure(throwable instanceof Exception ex ? ex : new RuntimeException("worker crash", throwable));
  }

  private void signalFailure(Exception ex) {
    metrics.increment("pipeline.worker.error");
    if (failure.compareAndSet(null, ex)) {
      stopRequested.set(true);
      log.error("Detection worker {} failed", Thread.currentThread().getName(), ex);
      ExecutorService pool = executor;
      if (pool != null) {
        pool.shutdown();
      }
      onFailure.accept(ex);
    }
  }
}
