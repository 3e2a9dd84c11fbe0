package dev.chatpulse.application.port;

import dev.chatpulse.domain.chat.RawFrame;

/**
 * Receives frames streamed by {@link ChatTransport#run(FrameSink)} in arrival order.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FrameSink {
  /**
   * Accepts one frame. Blocking here throttles the transport.
   *
   * @param frame complete frame received after the JOIN acknowledgement
   * @throws InterruptedException if the calling thread is interrupted while blocked
   */
  void onFrame(RawFrame frame) throws InterruptedException;
}
