package dev.chatpulse.testutil;

import dev.chatpulse.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Clock advanced explicitly by tests. */
public final class ManualClock implements ClockPort {
  private final AtomicLong now;

  public ManualClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void set(long millis) {
    now.set(millis);
  }

  public void advance(long millis) {
    now.addAndGet(millis);
  }
}
