/**
 * OpenTelemetry implementation of {@link dev.chatpulse.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for the reader thread and
 * every detection worker.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code transport.*}, {@code decode.*}, {@code pipeline.*},
 * {@code detect.*}, and {@code session.*}.</p>
 */
package dev.chatpulse.infrastructure.metrics;
