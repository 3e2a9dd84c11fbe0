package dev.chatpulse.application.pipeline;

import dev.chatpulse.application.port.ClockPort;
import dev.chatpulse.application.port.DetectionListener;
import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.domain.chat.ChatEvent;
import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.chat.LiveEvent;
import dev.chatpulse.domain.detect.CooldownGate;
import dev.chatpulse.domain.detect.DetectionSettings;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeCatalog;
import dev.chatpulse.domain.detect.MemeKind;
import dev.chatpulse.domain.detect.MemeMatcher;
import dev.chatpulse.domain.detect.SlidingWindow;
import dev.chatpulse.domain.detect.WaveEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window meme detector with an aggregate wave and per-meme hot moments.
 *
 * <p>Every match updates the meme's own window and the aggregate window. A hot moment fires when one
 * meme reaches the hot-moment threshold inside the window; a wave fires when the aggregate window
 * reaches the wave threshold and has spanned at least the wave minimum duration. Each tracker owns a
 * {@link CooldownGate}, so triggers of different trackers never suppress each other.</p>
 *
 * <p>Thread-safe: each tracker has its own lock, and the clock is read inside that lock and clamped to
 * the newest window entry so appends stay ordered under concurrent workers. Listener callbacks run
 * after the lock is released.</p>
 *
 * @since 0.1.0
 */
public final class PatternDetector {
  private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);
  private static final long UNSET = Long.MIN_VALUE;

  private final List<MemeTracker> memes;
  private final WaveTracker wave;
  private final DetectionSettings settings;
  private final ClockPort clock;
  private final DetectionListener listener;
  private final MetricsPort metrics;
  private final long windowSeconds;

  /**
   * Creates a detector.
   *
   * @param catalog memes to track
   * @param settings thresholds, window, and cooldown
   * @param clock time source
   * @param listener receives matches, triggers, and donations
   * @param metrics metrics sink for {@code detect.*}
   */
  public PatternDetector(
      MemeCatalog catalog,
      DetectionSettings settings,
      ClockPort clock,
      DetectionListener listener,
      MetricsPort metrics) {
    Objects.requireNonNull(catalog, "catalog");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.windowSeconds = settings.window().toSeconds();
    List<MemeTracker> trackers = new ArrayList<>();
    for (MemeKind kind : catalog.kinds()) {
      trackers.add(new MemeTracker(new MemeMatcher(kind), settings));
    }
    this.memes = List.copyOf(trackers);
    this.wave = new WaveTracker(settings);
  }

  /**
   * Processes one decoded event.
   *
   * @param event chat message or donation; other kinds are ignored
   */
  public void onEvent(LiveEvent event) {
    if (event instanceof ChatEvent chat) {
      onChat(chat);
    } else if (event instanceof DonationEvent donation) {
      metrics.increment("detect.donations");
      listener.onDonation(donation);
    }
  }

  private void onChat(ChatEvent chat) {
    String text = chat.text();
    for (MemeTracker tracker : memes) {
      if (tracker.matcher.matches(text)) {
        onMatch(tracker);
      }
    }
  }

  private void onMatch(MemeTracker tracker) {
    MemeKind kind = tracker.matcher.kind();
    metrics.increment("detect.matches");
    HotMomentRecord hotMoment = null;
    long matchedAt;
    synchronized (tracker) {
      long now = tracker.window.clamp(clock.nowMillis());
      matchedAt = now;
      int count = tracker.window.record(now);
      if (count >= settings.hotMomentThreshold()) {
        if (tracker.gate.tryClaim(now)) {
          hotMoment = HotMomentRecord.of(Instant.ofEpochMilli(now), kind, count, windowSeconds);
          tracker.window.clear();
        } else {
          metrics.increment("detect.hotMoment.suppressed");
        }
      }
    }
    listener.onMemeMatched(kind, Instant.ofEpochMilli(matchedAt));
    if (hotMoment != null) {
      metrics.increment("detect.hotMoment.fired");
      log.info("Hot moment: {}", hotMoment.description());
      listener.onHotMoment(hotMoment);
    }
    WaveEvent waveEvent = wave.onMatch();
    if (waveEvent != null) {
      metrics.increment("detect.wave.fired");
      log.info("Wave detected: {} matches within {}s", waveEvent.count(), windowSeconds);
      listener.onWave(waveEvent);
    }
  }

  private static final class MemeTracker {
    private final MemeMatcher matcher;
    private final SlidingWindow window;
    private final CooldownGate gate;

    private MemeTracker(MemeMatcher matcher, DetectionSettings settings) {
      this.matcher = matcher;
      this.window = new SlidingWindow(settings.window().toMillis());
      this.gate = new CooldownGate(settings.cooldown().toMillis());
    }
  }

  private final class WaveTracker {
    private final SlidingWindow window;
    private final CooldownGate gate;
    private final long minDurationMillis;
    private long windowStart = UNSET;

    private WaveTracker(DetectionSettings settings) {
      this.window = new SlidingWindow(settings.window().toMillis());
      this.gate = new CooldownGate(settings.cooldown().toMillis());
      this.minDurationMillis = settings.waveMinDuration().toMillis();
    }

    private synchronized WaveEvent onMatch() {
      long now = window.clamp(clock.nowMillis());
      window.prune(now);
      if (window.isEmpty()) {
        windowStart = UNSET;
      }
      window.append(now);
      if (windowStart == UNSET) {
        windowStart = window.oldest();
      }
      int count = window.size();
      if (count < settings.waveThreshold() || now - windowStart < minDurationMillis) {
        return null;
      }
      if (!gate.tryClaim(now)) {
        metrics.increment("detect.wave.suppressed");
        return null;
      }
      window.clear();
      windowStart = UNSET;
      return new WaveEvent(Instant.ofEpochMilli(now), count);
    }
  }
}
