package com.mk.fx.qa.stress.metrics;

import com.mk.fx.qa.stress.model.OperationType;

/**
 * One partition of the recorder state. Each recording thread maps to a stripe, so threads only
 * contend with the few others sharing it, and one operation is applied to all of its counters under
 * a single lock.
 */
final class RecorderStripe {

  private final MutableTotals[] perType;

  RecorderStripe(int bucketCount) {
    perType = new MutableTotals[OperationType.values().length];
    for (int i = 0; i < perType.length; i++) {
      perType[i] = new MutableTotals(bucketCount);
    }
  }

  synchronized void record(
      OperationType type,
      int bucket,
      long micros,
      long sizeBytes,
      boolean success,
      String failureKind) {
    perType[type.ordinal()].record(bucket, micros, sizeBytes, success, failureKind);
  }

  /** Adds this stripe's cumulative state to {@code targets}, indexed by operation ordinal. */
  synchronized void addTo(MutableTotals[] targets) {
    for (int i = 0; i < perType.length; i++) {
      perType[i].addTo(targets[i]);
    }
  }
}
