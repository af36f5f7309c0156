package com.mk.fx.qa.stress.metrics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Unsynchronised accumulator for one operation type; callers provide the locking. */
final class MutableTotals {

  private final long[] buckets;
  private final Map<String, Long> failureKinds = new HashMap<>();
  private long count;
  private long successCount;
  private long failureCount;
  private long bytes;
  private long minMicros = Long.MAX_VALUE;
  private long maxMicros;
  private long sumMicros;
  private double sumOfSquaresMicros;

  MutableTotals(int bucketCount) {
    this.buckets = new long[bucketCount];
  }

  void record(int bucket, long micros, long sizeBytes, boolean success, String failureKind) {
    count++;
    if (success) {
      successCount++;
      bytes += sizeBytes;
    } else {
      failureCount++;
      failureKinds.merge(failureKind, 1L, Long::sum);
    }
    buckets[bucket]++;
    if (micros < minMicros) minMicros = micros;
    if (micros > maxMicros) maxMicros = micros;
    sumMicros += micros;
    sumOfSquaresMicros += (double) micros * micros;
  }

  void addTo(MutableTotals target) {
    if (count == 0) return;
    target.count += count;
    target.successCount += successCount;
    target.failureCount += failureCount;
    target.bytes += bytes;
    for (int i = 0; i < buckets.length; i++) {
      target.buckets[i] += buckets[i];
    }
    target.minMicros = Math.min(target.minMicros, minMicros);
    target.maxMicros = Math.max(target.maxMicros, maxMicros);
    target.sumMicros += sumMicros;
    target.sumOfSquaresMicros += sumOfSquaresMicros;
    failureKinds.forEach((kind, n) -> target.failureKinds.merge(kind, n, Long::sum));
  }

  OperationTotals toTotals() {
    List<Long> counts = new ArrayList<>(buckets.length);
    for (long b : buckets) counts.add(b);
    var histogram =
        new HistogramSnapshot(
            counts,
            count,
            count == 0 ? 0 : minMicros,
            maxMicros,
            sumMicros,
            sumOfSquaresMicros);
    return new OperationTotals(count, successCount, failureCount, bytes, failureKinds, histogram);
  }
}
