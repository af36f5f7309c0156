package com.mk.fx.qa.stress.metrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed latency bucket upper bounds, in microseconds, shared by every worker of a run.
 *
 * <p>Bucket {@code i} holds values in {@code (bound[i-1], bound[i]]}, bucket 0 starts at zero and
 * one extra overflow bucket holds everything above the last bound. Histograms built from equal
 * boundaries merge exactly by adding counts bucket-by-bucket.
 */
public final class LatencyBuckets {

  /** 1-2-5 series from 10µs to 50s. */
  private static final long[] DEFAULT_BOUNDS_MICROS = {
    10, 20, 50,
    100, 200, 500,
    1_000, 2_000, 5_000,
    10_000, 20_000, 50_000,
    100_000, 200_000, 500_000,
    1_000_000, 2_000_000, 5_000_000,
    10_000_000, 20_000_000, 50_000_000
  };

  private static final LatencyBuckets DEFAULTS = new LatencyBuckets(DEFAULT_BOUNDS_MICROS);

  private final long[] upperBoundsMicros;

  private LatencyBuckets(long[] upperBoundsMicros) {
    this.upperBoundsMicros = upperBoundsMicros;
  }

  public static LatencyBuckets defaults() {
    return DEFAULTS;
  }

  /**
   * Builds buckets from explicit upper bounds.
   *
   * @throws IllegalArgumentException if the list is empty, or bounds are not positive and strictly
   *     increasing
   */
  public static LatencyBuckets of(List<Long> upperBoundsMicros) {
    Objects.requireNonNull(upperBoundsMicros, "upperBoundsMicros");
    if (upperBoundsMicros.isEmpty()) {
      throw new IllegalArgumentException("At least one latency bucket boundary is required");
    }
    long[] bounds = new long[upperBoundsMicros.size()];
    long previous = 0;
    for (int i = 0; i < bounds.length; i++) {
      Long value = upperBoundsMicros.get(i);
      if (value == null || value <= previous) {
        throw new IllegalArgumentException(
            "Latency bucket boundaries must be positive and strictly increasing: "
                + upperBoundsMicros);
      }
      bounds[i] = value;
      previous = value;
    }
    return new LatencyBuckets(bounds);
  }

  /** Number of buckets including the overflow bucket. */
  public int bucketCount() {
    return upperBoundsMicros.length + 1;
  }

  /** Index of the bucket a latency falls into. */
  public int indexOf(long micros) {
    int idx = Arrays.binarySearch(upperBoundsMicros, micros);
    return idx >= 0 ? idx : -idx - 1;
  }

  /** Exclusive lower edge of bucket {@code i}; zero for the first bucket. */
  public long lowerBoundMicros(int bucket) {
    return bucket == 0 ? 0 : upperBoundsMicros[bucket - 1];
  }

  /** Inclusive upper edge of bucket {@code i}; {@link Long#MAX_VALUE} for the overflow bucket. */
  public long upperBoundMicros(int bucket) {
    return bucket < upperBoundsMicros.length ? upperBoundsMicros[bucket] : Long.MAX_VALUE;
  }

  public List<Long> asList() {
    List<Long> list = new ArrayList<>(upperBoundsMicros.length);
    for (long bound : upperBoundsMicros) {
      list.add(bound);
    }
    return Collections.unmodifiableList(list);
  }

  /** True when {@code bounds} describes exactly these buckets. */
  public boolean matches(List<Long> bounds) {
    if (bounds == null || bounds.size() != upperBoundsMicros.length) {
      return false;
    }
    for (int i = 0; i < upperBoundsMicros.length; i++) {
      if (!Objects.equals(bounds.get(i), upperBoundsMicros[i])) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LatencyBuckets other)) return false;
    return Arrays.equals(upperBoundsMicros, other.upperBoundsMicros);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(upperBoundsMicros);
  }

  @Override
  public String toString() {
    return "LatencyBuckets" + Arrays.toString(upperBoundsMicros);
  }
}
