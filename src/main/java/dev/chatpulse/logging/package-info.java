/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize chat content before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe from the reader and worker threads.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; the MDC key {@code pipeline} tags
 * reader and worker threads.</p>
 * <p><strong>Security:</strong> {@link dev.chatpulse.logging.Logs#redact(String)} keeps entry tokens out of logs.</p>
 *
 * @since 0.1.0
 */
package dev.chatpulse.logging;
