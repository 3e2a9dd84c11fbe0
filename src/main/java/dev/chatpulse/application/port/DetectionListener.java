package dev.chatpulse.application.port;

import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeKind;
import dev.chatpulse.domain.detect.WaveEvent;
import java.time.Instant;

/**
 * Receives detector results. Called from worker threads outside any detector lock.
 *
 * @since 0.1.0
 */
public interface DetectionListener {
  /**
   * A message matched a meme.
   *
   * @param kind matched meme
   * @param at match time
   */
  void onMemeMatched(MemeKind kind, Instant at);

  /**
   * The aggregate wave fired.
   *
   * @param event wave details
   */
  void onWave(WaveEvent event);

  /**
   * A per-meme hot moment fired.
   *
   * @param record hot-moment details
   */
  void onHotMoment(HotMomentRecord record);

  /**
   * A donation arrived.
   *
   * @param event donation
   */
  void onDonation(DonationEvent event);
}
