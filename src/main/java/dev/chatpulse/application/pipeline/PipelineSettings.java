package dev.chatpulse.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Queue and worker tuning for one session pipeline.
 *
 * @param queueCapacity ingest queue capacity
 * @param workers detection worker count
 * @param shutdownTimeout how long closing waits for the reader and the workers before interrupting them
 * @since 0.1.0
 */
public record PipelineSettings(int queueCapacity, int workers, Duration shutdownTimeout) {
  /** Default queue capacity. */
  public static final int DEFAULT_QUEUE_CAPACITY = 1024;
  /** Default worker count. */
  public static final int DEFAULT_WORKERS = 3;
  /** Default close timeout. */
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /** Normalizes settings by clamping workers and queue capacity to at least one. */
  public PipelineSettings {
    workers = Math.max(1, workers);
    queueCapacity = Math.max(1, queueCapacity);
    shutdownTimeout = Objects.requireNonNullElse(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  /**
   * Returns the stock settings: capacity 1024, 3 workers, 5 s shutdown timeout.
   *
   * @return default settings
   */
  public static PipelineSettings defaults() {
    return new PipelineSettings(DEFAULT_QUEUE_CAPACITY, DEFAULT_WORKERS, DEFAULT_SHUTDOWN_TIMEOUT);
  }
}
