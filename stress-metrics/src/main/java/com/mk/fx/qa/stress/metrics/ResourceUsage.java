package com.mk.fx.qa.stress.metrics;

/**
 * Process resource gauges sampled when a snapshot is taken. Peaks cover the whole life of the
 * process, so they survive lost snapshots like the cumulative counters do.
 *
 * @param processCpuLoad recent CPU usage of the process between 0 and 1, 0 when unavailable
 */
public record ResourceUsage(
    long heapUsedBytes,
    long heapPeakBytes,
    double processCpuLoad,
    int liveThreads,
    int peakThreads) {}
