/**
 * Session aggregate, its immutable snapshots, and the broadcast status that drives its lifecycle.
 * <p><strong>Concurrency:</strong> {@link dev.chatpulse.domain.session.Session} guards its tally with its own
 * monitor; every other type is immutable.</p>
 *
 * @since 0.1.0
 */
package dev.chatpulse.domain.session;
