package com.mk.fx.qa.stress.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.stress.MutableClock;
import com.mk.fx.qa.stress.metrics.transport.SnapshotTransport;
import com.mk.fx.qa.stress.model.OperationType;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LocalAggregatorTest {

  /** Collects published snapshots in memory. */
  static class CapturingTransport implements SnapshotTransport {
    final List<WorkerSnapshot> published = new CopyOnWriteArrayList<>();
    long dropped;
    boolean closed;

    @Override
    public void publish(WorkerSnapshot snapshot) {
      published.add(snapshot);
    }

    @Override
    public long droppedSnapshots() {
      return dropped;
    }

    @Override
    public boolean flush(Duration grace) {
      return true;
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
  private final OperationRecorder recorder =
      new OperationRecorder("worker-a", LatencyBuckets.defaults(), clock);
  private final CapturingTransport transport = new CapturingTransport();

  @Test
  void flushNow_publishesCumulativeTotalsWithIncreasingSequence() {
    var local = new LocalAggregator(recorder, transport, Duration.ofSeconds(5), clock);

    recorder.recordSuccess(OperationType.UPLOAD, 100, Duration.ofMillis(2));
    var first = local.flushNow();
    recorder.recordSuccess(OperationType.UPLOAD, 100, Duration.ofMillis(2));
    clock.advance(Duration.ofSeconds(5));
    var second = local.flushNow();

    assertEquals(1, first.sequence());
    assertEquals(2, second.sequence());
    assertEquals(1, first.operations().get(OperationType.UPLOAD).count());
    assertEquals(2, second.operations().get(OperationType.UPLOAD).count());
    assertEquals(200, second.operations().get(OperationType.UPLOAD).bytes());
    assertEquals("worker-a", second.workerId());
    assertEquals(recorder.getStartedAt(), second.startedAt());
    assertEquals(clock.instant(), second.createdAt());
    assertEquals(LatencyBuckets.defaults().asList(), second.bucketBoundariesMicros());
    assertFalse(second.finalSnapshot());
    assertEquals(List.of(first, second), transport.published);
  }

  @Test
  void snapshot_carriesInvalidAndDroppedCounters() {
    var local = new LocalAggregator(recorder, transport, Duration.ofSeconds(5), clock);
    recorder.recordSuccess(OperationType.UPLOAD, -5, Duration.ofMillis(1));
    transport.dropped = 3;

    var snapshot = local.flushNow();

    assertEquals(1, snapshot.invalidRecords());
    assertEquals(3, snapshot.droppedSnapshots());
  }

  @Test
  void stop_publishesFinalSnapshotOnce() {
    var local = new LocalAggregator(recorder, transport, Duration.ofSeconds(5), clock);
    local.flushNow();

    assertTrue(local.stop(Duration.ofSeconds(1)));
    assertTrue(local.stop(Duration.ofSeconds(1)));

    assertEquals(2, transport.published.size());
    var last = transport.published.get(1);
    assertTrue(last.finalSnapshot());
    assertEquals(2, last.sequence());
    assertThrows(IllegalStateException.class, local::flushNow);
  }

  @Test
  void start_flushesOnTimerUntilStopped() throws Exception {
    var local = new LocalAggregator(recorder, transport, Duration.ofMillis(20), clock);
    local.start();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (transport.published.size() < 2 && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    local.stop(Duration.ofSeconds(1));

    assertTrue(transport.published.size() >= 3);
    var last = transport.published.get(transport.published.size() - 1);
    assertTrue(last.finalSnapshot());
    for (int i = 1; i < transport.published.size(); i++) {
      assertTrue(
          transport.published.get(i).sequence() > transport.published.get(i - 1).sequence());
    }
    assertThrows(IllegalStateException.class, local::start);
  }

  @Test
  void constructor_rejectsNonPositiveInterval() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LocalAggregator(recorder, transport, Duration.ZERO, clock));
  }

  @Test
  void snapshot_carriesSampledResourceUsage() {
    var usage = new ResourceUsage(10_000L, 20_000L, 0.5, 12, 15);
    var sampler =
        new ResourceSampler() {
          @Override
          public ResourceUsage sample() {
            return usage;
          }
        };
    var local = new LocalAggregator(recorder, transport, Duration.ofSeconds(5), clock, sampler);

    assertEquals(usage, local.flushNow().resources());
  }

  @Test
  void snapshot_failingSampler_stillPublishesWithoutResources() {
    var sampler =
        new ResourceSampler() {
          @Override
          public ResourceUsage sample() {
            throw new IllegalStateException("no management beans");
          }
        };
    var local = new LocalAggregator(recorder, transport, Duration.ofSeconds(5), clock, sampler);
    recorder.recordSuccess(OperationType.LIST, 0, Duration.ofMillis(1));

    var snapshot = local.flushNow();

    assertNull(snapshot.resources());
    assertEquals(1, snapshot.operations().get(OperationType.LIST).count());
    assertEquals(1, transport.published.size());
  }
}
