package com.mk.fx.qa.stress.metrics.transport;

import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import java.time.Duration;

/**
 * Carries worker snapshots to the global aggregator. Delivery is at-least-once at best: snapshots
 * may be lost, duplicated or reordered, which cumulative snapshots and per-worker sequence numbers
 * make harmless.
 */
public interface SnapshotTransport extends AutoCloseable {

  /** Hands a snapshot over for delivery. Never blocks the caller on delivery. */
  void publish(WorkerSnapshot snapshot);

  /** Snapshots given up on so far, for any reason. */
  long droppedSnapshots();

  /**
   * Waits until everything published has been delivered or dropped.
   *
   * @return false if {@code grace} elapsed with deliveries still pending
   */
  boolean flush(Duration grace);

  @Override
  void close();
}
