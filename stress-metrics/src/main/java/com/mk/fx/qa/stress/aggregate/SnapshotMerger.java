package com.mk.fx.qa.stress.aggregate;

import com.mk.fx.qa.stress.metrics.OperationTotals;
import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import com.mk.fx.qa.stress.model.OperationType;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Sums the latest cumulative snapshot of every worker into per-operation totals.
 *
 * <p>Snapshots are folded in worker-id order so that floating-point sums come out bit-identical
 * whatever order the snapshots arrived in.
 */
final class SnapshotMerger {

  private SnapshotMerger() {}

  static Map<OperationType, OperationTotals> merge(
      Collection<WorkerSnapshot> snapshots, int bucketCount) {
    Map<OperationType, OperationTotals> merged = new EnumMap<>(OperationType.class);
    for (OperationType type : OperationType.values()) {
      merged.put(type, OperationTotals.empty(bucketCount));
    }
    List<WorkerSnapshot> ordered =
        snapshots.stream().sorted(Comparator.comparing(WorkerSnapshot::workerId)).toList();
    for (WorkerSnapshot snapshot : ordered) {
      snapshot
          .operations()
          .forEach((type, totals) -> merged.merge(type, totals, OperationTotals::merge));
    }
    return merged;
  }

  /** All operation types folded into one, in declaration order. */
  static OperationTotals combine(Map<OperationType, OperationTotals> perType, int bucketCount) {
    OperationTotals combined = OperationTotals.empty(bucketCount);
    for (OperationType type : OperationType.values()) {
      OperationTotals totals = perType.get(type);
      if (totals != null) combined = combined.merge(totals);
    }
    return combined;
  }
}
