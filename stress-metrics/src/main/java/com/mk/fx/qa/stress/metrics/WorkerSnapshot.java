package com.mk.fx.qa.stress.metrics;

import com.mk.fx.qa.stress.model.OperationType;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cumulative report of one worker: totals since the worker started, never since the previous
 * snapshot. Also the JSON body workers post to the coordinator.
 *
 * @param sequence strictly increasing per worker, starting at 1
 * @param finalSnapshot true for the snapshot flushed on stop
 * @param bucketBoundariesMicros boundaries the histograms were built with
 * @param invalidRecords records the worker discarded so far
 * @param droppedSnapshots snapshots the worker failed to deliver so far
 * @param resources process gauges at capture time, null when not sampled
 */
public record WorkerSnapshot(
    String workerId,
    long sequence,
    Instant startedAt,
    Instant createdAt,
    boolean finalSnapshot,
    List<Long> bucketBoundariesMicros,
    Map<OperationType, OperationTotals> operations,
    long invalidRecords,
    long droppedSnapshots,
    ResourceUsage resources) {

  public WorkerSnapshot {
    bucketBoundariesMicros =
        bucketBoundariesMicros == null ? List.of() : List.copyOf(bucketBoundariesMicros);
    operations =
        operations == null || operations.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(operations));
  }
}
