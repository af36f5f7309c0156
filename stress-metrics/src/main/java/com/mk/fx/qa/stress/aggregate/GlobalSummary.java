package com.mk.fx.qa.stress.aggregate;

import java.time.Instant;
import java.util.List;

/**
 * The merged view across all known workers, recomputed on demand from the latest snapshot of each.
 *
 * @param finalSummary true once the run has been finalized; the view no longer changes
 * @param staleContributions true when any stale worker's last totals are included
 * @param droppedSnapshots snapshots the workers report they failed to deliver
 * @param invalidRecords records the workers report they discarded
 * @param rejectedSnapshots snapshots this aggregator refused as malformed or incompatible
 */
public record GlobalSummary(
    Instant generatedAt,
    Instant startedAt,
    double elapsedSeconds,
    boolean finalSummary,
    List<OperationSummary> operations,
    OperationSummary combined,
    List<WorkerState> workers,
    int activeWorkers,
    int staleWorkers,
    int finishedWorkers,
    boolean staleContributions,
    long droppedSnapshots,
    long invalidRecords,
    long rejectedSnapshots,
    List<Long> bucketBoundariesMicros) {

  public static final String COMBINED = "all";

  public GlobalSummary {
    operations = List.copyOf(operations);
    workers = List.copyOf(workers);
    bucketBoundariesMicros = List.copyOf(bucketBoundariesMicros);
  }
}
