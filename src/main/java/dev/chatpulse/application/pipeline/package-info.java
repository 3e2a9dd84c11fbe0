/**
 * <strong>Purpose:</strong> The live detection pipeline: session lifecycle, reader-to-worker hand-off, and the
 * sliding-window detector.
 * <p><strong>Pipeline role:</strong> Application layer; wires {@link dev.chatpulse.application.port.ChatTransport}
 * output through {@link dev.chatpulse.application.pipeline.IngestQueue} into
 * {@link dev.chatpulse.application.pipeline.PatternDetector} via {@link dev.chatpulse.application.pipeline.WorkerPool}.</p>
 * <p><strong>Concurrency:</strong> One reader thread, one bounded queue, a fixed worker pool. The reader blocks only
 * on the socket hand-off and on a full queue; workers block only on {@code poll}.</p>
 * <p><strong>Metrics:</strong> Emits {@code session.*}, {@code pipeline.*}, and {@code detect.*}.</p>
 *
 * @since 0.1.0
 */
package dev.chatpulse.application.pipeline;
