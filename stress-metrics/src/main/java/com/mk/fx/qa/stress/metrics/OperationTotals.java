package com.mk.fx.qa.stress.metrics;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cumulative totals for one operation type: attempts, outcomes, bytes moved by successful
 * operations, failures by kind and the latency histogram.
 */
public record OperationTotals(
    long count,
    long successCount,
    long failureCount,
    long bytes,
    Map<String, Long> failureKinds,
    HistogramSnapshot latency) {

  public OperationTotals {
    failureKinds = failureKinds == null ? Map.of() : Map.copyOf(failureKinds);
    Objects.requireNonNull(latency, "latency");
  }

  public static OperationTotals empty(int bucketCount) {
    return new OperationTotals(0, 0, 0, 0, Map.of(), HistogramSnapshot.empty(bucketCount));
  }

  /** Element-wise sum; commutative, and the identity is {@link #empty(int)}. */
  public OperationTotals merge(OperationTotals other) {
    Map<String, Long> kinds = new TreeMap<>(failureKinds);
    other.failureKinds.forEach((kind, n) -> kinds.merge(kind, n, Long::sum));
    return new OperationTotals(
        count + other.count,
        successCount + other.successCount,
        failureCount + other.failureCount,
        bytes + other.bytes,
        kinds,
        latency.merge(other.latency));
  }
}
