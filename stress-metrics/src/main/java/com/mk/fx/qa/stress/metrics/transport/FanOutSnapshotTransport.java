package com.mk.fx.qa.stress.metrics.transport;

import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import java.time.Duration;
import java.util.List;

/**
 * Publishes every snapshot to several transports; used by workers that keep a local view while
 * reporting to a coordinator. Drops are taken from the last transport, the remote one by
 * convention.
 */
public class FanOutSnapshotTransport implements SnapshotTransport {

  private final List<SnapshotTransport> targets;

  public FanOutSnapshotTransport(List<SnapshotTransport> targets) {
    if (targets == null || targets.isEmpty()) {
      throw new IllegalArgumentException("At least one transport is required");
    }
    this.targets = List.copyOf(targets);
  }

  @Override
  public void publish(WorkerSnapshot snapshot) {
    for (SnapshotTransport target : targets) {
      target.publish(snapshot);
    }
  }

  @Override
  public long droppedSnapshots() {
    return targets.get(targets.size() - 1).droppedSnapshots();
  }

  @Override
  public boolean flush(Duration grace) {
    long deadline = System.nanoTime() + grace.toNanos();
    boolean all = true;
    for (SnapshotTransport target : targets) {
      long left = Math.max(0, deadline - System.nanoTime());
      all &= target.flush(Duration.ofNanos(left));
    }
    return all;
  }

  @Override
  public void close() {
    for (SnapshotTransport target : targets) {
      target.close();
    }
  }
}
