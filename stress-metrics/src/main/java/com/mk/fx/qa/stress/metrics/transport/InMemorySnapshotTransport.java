package com.mk.fx.qa.stress.metrics.transport;

import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/** Single-process handoff: delivers each snapshot directly to an in-process consumer. */
@Slf4j
public class InMemorySnapshotTransport implements SnapshotTransport {

  private final Consumer<WorkerSnapshot> sink;
  private final LongAdder dropped = new LongAdder();

  public InMemorySnapshotTransport(Consumer<WorkerSnapshot> sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  @Override
  public void publish(WorkerSnapshot snapshot) {
    try {
      sink.accept(snapshot);
    } catch (RuntimeException e) {
      dropped.increment();
      log.warn(
          "In-process delivery of snapshot {}#{} failed: {}",
          snapshot.workerId(),
          snapshot.sequence(),
          e.getMessage(),
          e);
    }
  }

  @Override
  public long droppedSnapshots() {
    return dropped.sum();
  }

  @Override
  public boolean flush(Duration grace) {
    return true;
  }

  @Override
  public void close() {
    // nothing buffered
  }
}
