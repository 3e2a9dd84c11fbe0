/**
 * <strong>Purpose:</strong> Ports between the detection pipeline and its collaborators: chat transport,
 * session archive, clock, metrics, and detection callbacks.
 * <p><strong>Pipeline role:</strong> Application layer; adapters under {@code dev.chatpulse.infrastructure}
 * implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Entry tokens cross {@link dev.chatpulse.application.port.ChatTransport} and must
 * not be logged.</p>
 *
 * @since 0.1.0
 */
package dev.chatpulse.application.port;
