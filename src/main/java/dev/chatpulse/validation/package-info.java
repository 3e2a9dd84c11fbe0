/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Rejects invalid connection settings and pipeline tuning before the
 * transport, queue, or worker pool are created.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package dev.chatpulse.validation;
