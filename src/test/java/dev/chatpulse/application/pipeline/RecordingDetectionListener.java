package dev.chatpulse.application.pipeline;

import dev.chatpulse.application.port.DetectionListener;
import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeKind;
import dev.chatpulse.domain.detect.WaveEvent;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects detector callbacks for assertions. */
final class RecordingDetectionListener implements DetectionListener {
  final List<String> matches = new CopyOnWriteArrayList<>();
  final List<WaveEvent> waves = new CopyOnWriteArrayList<>();
  final List<HotMomentRecord> hotMoments = new CopyOnWriteArrayList<>();
  final List<DonationEvent> donations = new CopyOnWriteArrayList<>();

  @Override
  public void onMemeMatched(MemeKind kind, Instant at) {
    matches.add(kind.key());
  }

  @Override
  public void onWave(WaveEvent event) {
    waves.add(event);
  }

  @Override
  public void onHotMoment(HotMomentRecord record) {
    hotMoments.add(record);
  }

  @Override
  public void onDonation(DonationEvent event) {
    donations.add(event);
  }
}
