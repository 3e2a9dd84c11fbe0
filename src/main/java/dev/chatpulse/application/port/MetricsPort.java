package dev.chatpulse.application.port;

/**
 * <strong>What:</strong> Port abstracting chatpulse metrics emission.
 * <p><strong>Why:</strong> Lets the transport, decoder, and detection pipeline record counters and
 * observations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like dropped frames, matches, or triggers.</li>
 *   <li>Record numeric observations for queue depths and enqueue waits.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the reader
 * thread and every detection worker.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code decode.frame.malformed},
 * {@code pipeline.queue.depth}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code transport.frames.discarded}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram/gauge style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, queue depth); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates. Useful for tests.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
