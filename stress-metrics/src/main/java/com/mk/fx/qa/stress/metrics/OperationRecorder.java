package com.mk.fx.qa.stress.metrics;

import com.mk.fx.qa.stress.model.OperationType;
import com.mk.fx.qa.stress.model.Outcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe {@link Recorder} holding cumulative per-operation counters and latency histograms for
 * one process.
 *
 * <p>State is striped by recording thread; a capture adds every stripe together under each stripe's
 * own lock, so a captured total always has {@code count == successCount + failureCount ==
 * histogram count}. Memory is fixed by the number of stripes, operation types and buckets, plus at
 * most {@link #MAX_FAILURE_KINDS} failure kinds.
 */
@Slf4j
public class OperationRecorder implements Recorder {

  /** Distinct failure kinds kept per operation type; further kinds become {@code OTHER}. */
  static final int MAX_FAILURE_KINDS = 32;

  /** Longest duration accepted as a real operation. */
  static final Duration MAX_DURATION = Duration.ofHours(24);

  @Getter private final String workerId;
  @Getter private final LatencyBuckets buckets;
  @Getter private final Instant startedAt;
  private final Clock clock;
  private final RecorderStripe[] stripes;
  private final LongAdder invalidRecords = new LongAdder();
  private final Map<OperationType, Set<String>> knownFailureKinds =
      new EnumMap<>(OperationType.class);

  public OperationRecorder(String workerId, LatencyBuckets buckets, Clock clock) {
    this(workerId, buckets, clock, Math.max(4, Runtime.getRuntime().availableProcessors() * 2));
  }

  OperationRecorder(String workerId, LatencyBuckets buckets, Clock clock, int stripeCount) {
    this.workerId = Objects.requireNonNull(workerId, "workerId");
    this.buckets = Objects.requireNonNull(buckets, "buckets");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.startedAt = clock.instant();
    this.stripes = new RecorderStripe[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new RecorderStripe(buckets.bucketCount());
    }
    for (OperationType type : OperationType.values()) {
      knownFailureKinds.put(type, ConcurrentHashMap.newKeySet());
    }
  }

  @Override
  public void record(
      OperationType type, long sizeBytes, Duration duration, Outcome outcome, String failureKind) {
    record(
        new OperationRecord(
            type, sizeBytes, duration, outcome, failureKind, workerId, clock.instant()));
  }

  @Override
  public void record(OperationRecord record) {
    if (!isValid(record)) {
      invalidRecords.increment();
      log.debug("Discarding invalid operation record {}", record);
      return;
    }
    boolean success = record.outcome() == Outcome.SUCCESS;
    long micros = toMicros(record.duration());
    String kind =
        success ? null : boundedKind(record.type(), FailureKinds.normalise(record.failureKind()));
    stripeForCurrentThread()
        .record(record.type(), buckets.indexOf(micros), micros, record.sizeBytes(), success, kind);
  }

  /** Consistent cumulative totals for every operation type, including types never recorded. */
  public Map<OperationType, OperationTotals> captureTotals() {
    var types = OperationType.values();
    var targets = new MutableTotals[types.length];
    for (int i = 0; i < types.length; i++) {
      targets[i] = new MutableTotals(buckets.bucketCount());
    }
    for (RecorderStripe stripe : stripes) {
      stripe.addTo(targets);
    }
    Map<OperationType, OperationTotals> totals = new EnumMap<>(OperationType.class);
    for (OperationType type : types) {
      totals.put(type, targets[type.ordinal()].toTotals());
    }
    return Collections.unmodifiableMap(totals);
  }

  public long invalidRecords() {
    return invalidRecords.sum();
  }

  private boolean isValid(OperationRecord record) {
    return record != null
        && record.type() != null
        && record.outcome() != null
        && record.sizeBytes() >= 0
        && record.duration() != null
        && !record.duration().isNegative()
        && record.duration().compareTo(MAX_DURATION) <= 0;
  }

  private String boundedKind(OperationType type, String kind) {
    Set<String> known = knownFailureKinds.get(type);
    if (known.contains(kind)) return kind;
    synchronized (known) {
      if (known.contains(kind)) return kind;
      if (known.size() >= MAX_FAILURE_KINDS) return FailureKinds.OTHER;
      known.add(kind);
      return kind;
    }
  }

  private RecorderStripe stripeForCurrentThread() {
    return stripes[(int) Math.floorMod(Thread.currentThread().getId(), (long) stripes.length)];
  }

  private static long toMicros(Duration duration) {
    return duration.getSeconds() * 1_000_000L + duration.getNano() / 1_000;
  }
}
