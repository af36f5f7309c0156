package com.mk.fx.qa.stress.aggregate;

import com.mk.fx.qa.stress.metrics.HistogramSnapshot;
import com.mk.fx.qa.stress.metrics.LatencyBuckets;
import com.mk.fx.qa.stress.metrics.OperationTotals;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derived figures for one operation type (or all of them combined). Latencies are milliseconds
 * and null when nothing was recorded; rates are zero when undefined.
 *
 * @param successRate successes over attempts, between 0 and 1
 * @param throughputBytesPerSec bytes moved by successful operations over the run's elapsed time
 * @param opsPerSec successful operations over the run's elapsed time
 * @param latencyBucketCounts per-bucket counts, the last one being the overflow bucket
 */
public record OperationSummary(
    String operation,
    long count,
    long successCount,
    long failureCount,
    long bytes,
    double successRate,
    double throughputBytesPerSec,
    double opsPerSec,
    Double p50Ms,
    Double p95Ms,
    Double p99Ms,
    Double minMs,
    Double maxMs,
    Double meanMs,
    Double stdDevMs,
    Map<String, Long> failureKinds,
    List<Long> latencyBucketCounts,
    long latencySumMicros) {

  public static OperationSummary from(
      String operation, OperationTotals totals, LatencyBuckets buckets, double elapsedSeconds) {
    HistogramSnapshot latency = totals.latency();
    boolean timed = elapsedSeconds > 0;
    boolean sampled = latency.hasSamples();
    return new OperationSummary(
        operation,
        totals.count(),
        totals.successCount(),
        totals.failureCount(),
        totals.bytes(),
        totals.count() == 0 ? 0.0 : (double) totals.successCount() / totals.count(),
        timed ? totals.bytes() / elapsedSeconds : 0.0,
        timed ? totals.successCount() / elapsedSeconds : 0.0,
        toMillis(latency.percentileMicros(buckets, 50)),
        toMillis(latency.percentileMicros(buckets, 95)),
        toMillis(latency.percentileMicros(buckets, 99)),
        sampled ? latency.minMicros() / 1000.0 : null,
        sampled ? latency.maxMicros() / 1000.0 : null,
        toMillis(latency.meanMicros()),
        toMillis(latency.stdDevMicros()),
        totals.failureKinds(),
        latency.bucketCounts(),
        latency.sumMicros());
  }

  private static Double toMillis(Optional<Double> micros) {
    return micros.map(m -> m / 1000.0).orElse(null);
  }
}
