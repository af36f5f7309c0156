package com.mk.fx.qa.stress.aggregate;

import com.mk.fx.qa.stress.model.LivenessStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Decides whether a worker is still reporting, from the time its last snapshot arrived. */
public class LivenessMonitor {

  private final Duration silenceTimeout;

  public LivenessMonitor(Duration silenceTimeout) {
    this.silenceTimeout = Objects.requireNonNull(silenceTimeout, "silenceTimeout");
    if (silenceTimeout.isZero() || silenceTimeout.isNegative()) {
      throw new IllegalArgumentException("Silence timeout must be positive");
    }
  }

  public Duration getSilenceTimeout() {
    return silenceTimeout;
  }

  /**
   * Status of a worker at {@code now}. A finished worker stays finished; otherwise a worker silent
   * for longer than the timeout is stale.
   */
  public LivenessStatus evaluate(LivenessStatus current, Instant lastSeen, Instant now) {
    if (current == LivenessStatus.FINISHED) return LivenessStatus.FINISHED;
    return Duration.between(lastSeen, now).compareTo(silenceTimeout) > 0
        ? LivenessStatus.STALE
        : LivenessStatus.ACTIVE;
  }
}
