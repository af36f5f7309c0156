package com.mk.fx.qa.stress.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable latency histogram over {@link LatencyBuckets}, with running min, max, sum and sum of
 * squares. All latency values are microseconds. When {@code count == 0}, min and max are zero and
 * carry no meaning.
 */
public record HistogramSnapshot(
    List<Long> bucketCounts,
    long count,
    long minMicros,
    long maxMicros,
    long sumMicros,
    double sumOfSquaresMicros) {

  public HistogramSnapshot {
    bucketCounts = List.copyOf(Objects.requireNonNull(bucketCounts, "bucketCounts"));
  }

  public static HistogramSnapshot empty(int bucketCount) {
    return new HistogramSnapshot(Collections.nCopies(bucketCount, 0L), 0, 0, 0, 0, 0.0);
  }

  public boolean hasSamples() {
    return count > 0;
  }

  /**
   * Adds two histograms bucket-by-bucket. Both must share bucket boundaries.
   *
   * @throws IllegalArgumentException if the bucket counts differ in length
   */
  public HistogramSnapshot merge(HistogramSnapshot other) {
    if (other.bucketCounts.size() != bucketCounts.size()) {
      throw new IllegalArgumentException(
          "Cannot merge histograms with "
              + bucketCounts.size()
              + " and "
              + other.bucketCounts.size()
              + " buckets");
    }
    if (!other.hasSamples()) return this;
    if (!hasSamples()) return other;

    List<Long> merged = new ArrayList<>(bucketCounts.size());
    for (int i = 0; i < bucketCounts.size(); i++) {
      merged.add(bucketCounts.get(i) + other.bucketCounts.get(i));
    }
    return new HistogramSnapshot(
        merged,
        count + other.count,
        Math.min(minMicros, other.minMicros),
        Math.max(maxMicros, other.maxMicros),
        sumMicros + other.sumMicros,
        sumOfSquaresMicros + other.sumOfSquaresMicros);
  }

  /**
   * Estimates a percentile by locating the bucket that holds the target rank and interpolating
   * linearly inside it. The bucket range is clamped to the observed min and max, so estimates never
   * leave {@code [min, max]} and grow monotonically with {@code percentile}.
   *
   * @param buckets the boundaries this histogram was built with
   * @param percentile between 0 and 100
   * @return the estimate in microseconds, empty when nothing was recorded
   */
  public Optional<Double> percentileMicros(LatencyBuckets buckets, double percentile) {
    if (percentile < 0 || percentile > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    if (count == 0) return Optional.empty();

    long rank = Math.max(1, (long) Math.ceil((percentile / 100.0) * count));
    long seen = 0;
    for (int i = 0; i < bucketCounts.size(); i++) {
      long inBucket = bucketCounts.get(i);
      if (inBucket == 0) continue;
      if (seen + inBucket >= rank) {
        double lower = Math.max(buckets.lowerBoundMicros(i), minMicros);
        double upper = Math.min(buckets.upperBoundMicros(i), maxMicros);
        if (upper < lower) upper = lower;
        double fraction = (double) (rank - seen) / inBucket;
        return Optional.of(lower + (upper - lower) * fraction);
      }
      seen += inBucket;
    }
    return Optional.of((double) maxMicros);
  }

  public Optional<Double> meanMicros() {
    return count == 0 ? Optional.empty() : Optional.of((double) sumMicros / count);
  }

  public Optional<Double> stdDevMicros() {
    if (count == 0) return Optional.empty();
    double mean = (double) sumMicros / count;
    double variance = sumOfSquaresMicros / count - mean * mean;
    return Optional.of(Math.sqrt(Math.max(0.0, variance)));
  }
}
