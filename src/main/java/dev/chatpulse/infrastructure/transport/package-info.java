/**
 * WebSocket adapter for {@link dev.chatpulse.application.port.ChatTransport} built on OkHttp.
 * <p><strong>Concurrency:</strong> OkHttp callbacks run on OkHttp threads and hand events to the reader thread
 * through a bounded inbox.</p>
 * <p><strong>Metrics:</strong> {@code transport.connect.attempts}, {@code transport.failures},
 * {@code transport.frames.preJoin.discarded}, {@code transport.frames.streamed}, {@code transport.ping.sent}.</p>
 * <p><strong>Security:</strong> {@code wss} endpoints use the JVM default trust store.</p>
 */
package dev.chatpulse.infrastructure.transport;
