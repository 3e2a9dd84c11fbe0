/**
 * Thread factories for the reader thread and the detection worker pool.
 * <p><strong>Concurrency:</strong> Threads are non-daemon so a session drains before the JVM exits.</p>
 */
package dev.chatpulse.infrastructure.exec;
