package com.mk.fx.qa.stress.aggregate;

import com.mk.fx.qa.stress.metrics.LatencyBuckets;
import com.mk.fx.qa.stress.metrics.OperationTotals;
import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import com.mk.fx.qa.stress.model.IngestResult;
import com.mk.fx.qa.stress.model.LivenessStatus;
import com.mk.fx.qa.stress.model.OperationType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;

/**
 * Coordinator state: the latest accepted snapshot of every known worker plus its liveness.
 *
 * <p>A snapshot replaces the stored one only when its sequence number is strictly greater, so
 * duplicate, late and reordered deliveries are harmless. Snapshots from different workers are
 * applied independently; only the per-worker check is serialized. Summaries are a pure function of
 * the stored snapshots and the clock.
 */
@Slf4j
public class GlobalAggregator {

  private static final long FINAL_WAIT_POLL_MS = 50;

  private final LatencyBuckets buckets;
  private final LivenessMonitor liveness;
  private final Clock clock;
  private final Instant startedAt;
  private final Map<String, WorkerEntry> workers = new ConcurrentHashMap<>();
  private final LongAdder rejected = new LongAdder();
  private final Object finalizeLock = new Object();
  private volatile GlobalSummary finalSummary;

  public GlobalAggregator(LatencyBuckets buckets, LivenessMonitor liveness, Clock clock) {
    this.buckets = Objects.requireNonNull(buckets, "buckets");
    this.liveness = Objects.requireNonNull(liveness, "liveness");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.startedAt = clock.instant();
  }

  /** Applies a snapshot if it is newer than what is stored for its worker. */
  public IngestResult accept(WorkerSnapshot snapshot) {
    String problem = validate(snapshot);
    if (problem != null) {
      rejected.increment();
      log.warn("Rejected snapshot: {}", problem);
      return IngestResult.REJECTED;
    }
    if (finalSummary != null) {
      log.debug(
          "Run finalized, ignoring snapshot {}#{}", snapshot.workerId(), snapshot.sequence());
      return IngestResult.IGNORED;
    }

    Instant now = clock.instant();
    boolean[] applied = new boolean[1];
    WorkerEntry stored =
        workers.compute(
            snapshot.workerId(),
            (id, current) -> {
              if (current != null && current.snapshot().sequence() >= snapshot.sequence()) {
                return current;
              }
              applied[0] = true;
              boolean finished =
                  snapshot.finalSnapshot()
                      || (current != null && current.status() == LivenessStatus.FINISHED);
              if (current == null) {
                log.info("Worker {} reported for the first time", id);
              } else if (current.status() == LivenessStatus.STALE && !finished) {
                log.info("Worker {} is reporting again", id);
              }
              return new WorkerEntry(
                  snapshot, now, finished ? LivenessStatus.FINISHED : LivenessStatus.ACTIVE);
            });

    if (!applied[0]) {
      log.debug(
          "Ignoring snapshot {}#{}, already at #{}",
          snapshot.workerId(),
          snapshot.sequence(),
          stored.snapshot().sequence());
      return IngestResult.IGNORED;
    }
    if (snapshot.finalSnapshot()) {
      log.info(
          "Worker {} finished with final snapshot #{}", snapshot.workerId(), snapshot.sequence());
    }
    return IngestResult.ACCEPTED;
  }

  /** Re-evaluates every worker's liveness against the clock, logging transitions. */
  public void refreshLiveness() {
    if (finalSummary != null) return;
    Instant now = clock.instant();
    workers.replaceAll(
        (id, entry) -> {
          LivenessStatus next = liveness.evaluate(entry.status(), entry.lastSeen(), now);
          if (next == entry.status()) return entry;
          if (next == LivenessStatus.STALE) {
            log.warn(
                "Worker {} silent for more than {}s, marking stale",
                id,
                liveness.getSilenceTimeout().toSeconds());
          }
          return entry.withStatus(next);
        });
  }

  /** The final summary once the run is finalized, otherwise a fresh merge of the current state. */
  public GlobalSummary summary() {
    GlobalSummary done = finalSummary;
    if (done != null) return done;
    Instant now = clock.instant();
    List<WorkerEntry> entries = new ArrayList<>();
    for (WorkerEntry entry : workers.values()) {
      entries.add(entry.withStatus(liveness.evaluate(entry.status(), entry.lastSeen(), now)));
    }
    return buildSummary(entries, now, false);
  }

  public List<WorkerState> workers() {
    return summary().workers();
  }

  public boolean isFinalized() {
    return finalSummary != null;
  }

  public long rejectedSnapshots() {
    return rejected.sum();
  }

  public LatencyBuckets getBuckets() {
    return buckets;
  }

  /**
   * Waits up to {@code grace} for final snapshots, then freezes the summary. Workers that have not
   * finished by then are recorded as stale. Later calls return the same summary.
   *
   * @param expectedWorkers number of workers to wait for; zero waits only for workers already seen
   */
  public GlobalSummary finalizeRun(Duration grace, int expectedWorkers) {
    synchronized (finalizeLock) {
      if (finalSummary != null) return finalSummary;

      long deadline = System.nanoTime() + grace.toNanos();
      while (!allFinished(expectedWorkers) && System.nanoTime() < deadline) {
        try {
          Thread.sleep(FINAL_WAIT_POLL_MS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }

      Instant now = clock.instant();
      List<WorkerEntry> entries = new ArrayList<>();
      for (WorkerEntry entry : workers.values()) {
        if (entry.status() != LivenessStatus.FINISHED) {
          log.warn(
              "Worker {} did not deliver a final snapshot, last seen {} (#{}); recorded as stale",
              entry.snapshot().workerId(),
              entry.lastSeen(),
              entry.snapshot().sequence());
          entry = entry.withStatus(LivenessStatus.STALE);
        }
        entries.add(entry);
      }
      if (expectedWorkers > entries.size()) {
        log.warn(
            "Only {} of {} expected worker(s) ever reported", entries.size(), expectedWorkers);
      }
      finalSummary = buildSummary(entries, now, true);
      log.info(
          "Run finalized - {} worker(s), {} operation(s), stale contributions: {}",
          entries.size(),
          finalSummary.combined().count(),
          finalSummary.staleContributions());
      return finalSummary;
    }
  }

  private boolean allFinished(int expectedWorkers) {
    long finished =
        workers.values().stream().filter(e -> e.status() == LivenessStatus.FINISHED).count();
    if (expectedWorkers > 0) return finished >= expectedWorkers;
    return finished == workers.size();
  }

  private String validate(WorkerSnapshot snapshot) {
    if (snapshot == null) return "empty body";
    if (snapshot.workerId() == null || snapshot.workerId().isBlank()) return "missing workerId";
    if (snapshot.sequence() < 1) {
      return "sequence must be >= 1 for worker " + snapshot.workerId();
    }
    if (!buckets.matches(snapshot.bucketBoundariesMicros())) {
      return "bucket boundaries "
          + snapshot.bucketBoundariesMicros()
          + " from worker "
          + snapshot.workerId()
          + " differ from "
          + buckets.asList();
    }
    for (Map.Entry<OperationType, OperationTotals> e : snapshot.operations().entrySet()) {
      if (e.getKey() == null || e.getValue() == null) {
        return "null operation entry from worker " + snapshot.workerId();
      }
      if (e.getValue().latency().bucketCounts().size() != buckets.bucketCount()) {
        return "histogram for "
            + e.getKey().label()
            + " from worker "
            + snapshot.workerId()
            + " has the wrong number of buckets";
      }
    }
    return null;
  }

  private GlobalSummary buildSummary(List<WorkerEntry> entries, Instant now, boolean last) {
    entries.sort(Comparator.comparing(e -> e.snapshot().workerId()));

    Instant runStart = startedAt;
    for (WorkerEntry entry : entries) {
      Instant workerStart = entry.snapshot().startedAt();
      if (workerStart != null && workerStart.isBefore(runStart)) runStart = workerStart;
    }
    double elapsed = Math.max(0.0, Duration.between(runStart, now).toMillis() / 1000.0);

    int bucketCount = buckets.bucketCount();
    Map<OperationType, OperationTotals> merged =
        SnapshotMerger.merge(entries.stream().map(WorkerEntry::snapshot).toList(), bucketCount);
    List<OperationSummary> operations = new ArrayList<>();
    for (OperationType type : OperationType.values()) {
      operations.add(OperationSummary.from(type.label(), merged.get(type), buckets, elapsed));
    }
    OperationSummary combined =
        OperationSummary.from(
            GlobalSummary.COMBINED,
            SnapshotMerger.combine(merged, bucketCount),
            buckets,
            elapsed);

    List<WorkerState> states = new ArrayList<>();
    int active = 0;
    int stale = 0;
    int finished = 0;
    long dropped = 0;
    long invalid = 0;
    for (WorkerEntry entry : entries) {
      WorkerSnapshot s = entry.snapshot();
      long ops = s.operations().values().stream().mapToLong(OperationTotals::count).sum();
      states.add(
          new WorkerState(
              s.workerId(),
              s.sequence(),
              s.startedAt(),
              entry.lastSeen(),
              entry.status(),
              ops,
              s.droppedSnapshots(),
              s.invalidRecords(),
              s.resources()));
      switch (entry.status()) {
        case ACTIVE -> active++;
        case STALE -> stale++;
        case FINISHED -> finished++;
      }
      dropped += s.droppedSnapshots();
      invalid += s.invalidRecords();
    }

    return new GlobalSummary(
        now,
        runStart,
        elapsed,
        last,
        operations,
        combined,
        states,
        active,
        stale,
        finished,
        stale > 0,
        dropped,
        invalid,
        rejected.sum(),
        buckets.asList());
  }

  private record WorkerEntry(WorkerSnapshot snapshot, Instant lastSeen, LivenessStatus status) {
    WorkerEntry withStatus(LivenessStatus next) {
      return next == status ? this : new WorkerEntry(snapshot, lastSeen, next);
    }
  }
}
