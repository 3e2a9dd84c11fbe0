/**
 * Meme recognition and the time-window primitives behind wave and hot-moment detection.
 * <p><strong>Concurrency:</strong> {@link dev.chatpulse.domain.detect.SlidingWindow} is unsynchronized and owned
 * by one tracker lock; {@link dev.chatpulse.domain.detect.CooldownGate} is lock-free. Everything else is
 * immutable.</p>
 *
 * @since 0.1.0
 */
package dev.chatpulse.domain.detect;
