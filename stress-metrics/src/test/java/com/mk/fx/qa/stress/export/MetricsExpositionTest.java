package com.mk.fx.qa.stress.export;

import static com.mk.fx.qa.stress.TestSnapshots.BUCKETS;
import static com.mk.fx.qa.stress.TestSnapshots.snapshot;
import static com.mk.fx.qa.stress.TestSnapshots.totals;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.stress.MutableClock;
import com.mk.fx.qa.stress.TestSnapshots;
import com.mk.fx.qa.stress.aggregate.GlobalAggregator;
import com.mk.fx.qa.stress.aggregate.LivenessMonitor;
import com.mk.fx.qa.stress.metrics.ResourceUsage;
import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import com.mk.fx.qa.stress.model.OperationType;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class MetricsExpositionTest {

  private final MutableClock clock = new MutableClock(TestSnapshots.T0);
  private final GlobalAggregator aggregator =
      new GlobalAggregator(BUCKETS, new LivenessMonitor(Duration.ofSeconds(30)), clock);
  private final MetricsExposition exposition = new MetricsExposition();

  @Test
  void render_exposesCountersByOperationAndOutcome() {
    aggregator.accept(snapshot("A", 1, OperationType.UPLOAD, totals(3, 2, 300, 150)));

    String text = exposition.render(aggregator.summary());

    assertTrue(text.contains("# TYPE stress_operations_total counter\n"));
    assertTrue(
        text.contains("stress_operations_total{operation=\"upload\",outcome=\"success\"} 2\n"));
    assertTrue(
        text.contains("stress_operations_total{operation=\"upload\",outcome=\"failure\"} 1\n"));
    assertTrue(
        text.contains("stress_operations_total{operation=\"download\",outcome=\"success\"} 0\n"));
    assertTrue(text.contains("stress_operation_bytes_total{operation=\"upload\"} 300\n"));
    assertTrue(
        text.contains(
            "stress_operation_failures_total{operation=\"upload\",kind=\"SOCKET_TIMEOUT\"} 1\n"));
  }

  @Test
  void render_histogramBucketsAreCumulativeInSeconds() {
    aggregator.accept(snapshot("A", 1, OperationType.UPLOAD, totals(3, 3, 300, 150)));

    String text = exposition.render(aggregator.summary());

    assertTrue(text.contains("# TYPE stress_operation_latency_seconds histogram\n"));
    assertTrue(
        text.contains(
            "stress_operation_latency_seconds_bucket{operation=\"upload\",le=\"0.00001\"} 0\n"));
    assertTrue(
        text.contains(
            "stress_operation_latency_seconds_bucket{operation=\"upload\",le=\"0.0001\"} 0\n"));
    assertTrue(
        text.contains(
            "stress_operation_latency_seconds_bucket{operation=\"upload\",le=\"0.0002\"} 3\n"));
    assertTrue(
        text.contains(
            "stress_operation_latency_seconds_bucket{operation=\"upload\",le=\"50.0\"} 3\n"));
    assertTrue(
        text.contains(
            "stress_operation_latency_seconds_bucket{operation=\"upload\",le=\"+Inf\"} 3\n"));
    assertTrue(
        text.contains("stress_operation_latency_seconds_sum{operation=\"upload\"} 0.00045\n"));
    assertTrue(text.contains("stress_operation_latency_seconds_count{operation=\"upload\"} 3\n"));
  }

  @Test
  void render_flagsStaleWorkersAndDegradation() {
    aggregator.accept(snapshot("A", 1, OperationType.LIST, totals(1, 1, 0, 50)));
    aggregator.accept(null);
    clock.advance(Duration.ofSeconds(31));

    String text = exposition.render(aggregator.summary());

    assertTrue(text.contains("stress_workers{status=\"stale\"} 1\n"));
    assertTrue(text.contains("stress_worker_up{worker=\"A\",status=\"stale\"} 0\n"));
    assertTrue(text.contains("stress_summary_stale_contributions 1\n"));
    assertTrue(text.contains("stress_snapshots_rejected_total 1\n"));
    assertTrue(text.contains("stress_snapshots_dropped_total 0\n"));
    assertTrue(text.contains("stress_run_elapsed_seconds 31.0\n"));
  }

  @Test
  void render_emptyRun_stillExposesEveryOperation() {
    String text = exposition.render(aggregator.summary());

    for (OperationType type : OperationType.values()) {
      assertTrue(
          text.contains(
              "stress_operation_latency_seconds_count{operation=\"" + type.label() + "\"} 0\n"));
    }
    assertTrue(text.contains("stress_workers{status=\"active\"} 0\n"));
  }

  @Test
  void render_exposesWorkerResourceGauges_onlyForSampledWorkers() {
    var usage = new ResourceUsage(64_000_000L, 96_000_000L, 0.25, 21, 24);
    var sampled = snapshot("A", 1, OperationType.UPLOAD, totals(1, 1, 10, 150));
    aggregator.accept(
        new WorkerSnapshot(
            "A",
            1,
            sampled.startedAt(),
            sampled.createdAt(),
            false,
            sampled.bucketBoundariesMicros(),
            sampled.operations(),
            0,
            0,
            usage));
    aggregator.accept(snapshot("B", 1, OperationType.UPLOAD, totals(1, 1, 10, 150)));

    String text = exposition.render(aggregator.summary());

    assertTrue(text.contains("# TYPE stress_worker_heap_used_bytes gauge\n"));
    assertTrue(text.contains("stress_worker_heap_used_bytes{worker=\"A\"} 64000000\n"));
    assertTrue(text.contains("stress_worker_heap_peak_bytes{worker=\"A\"} 96000000\n"));
    assertTrue(text.contains("stress_worker_cpu_load{worker=\"A\"} 0.25\n"));
    assertTrue(text.contains("stress_worker_threads{worker=\"A\"} 21\n"));
    assertFalse(text.contains("stress_worker_threads{worker=\"B\"}"));
  }

  @Test
  void escape_quotesBackslashesAndNewlines() {
    assertEquals("a\\\"b\\\\c\\nd", MetricsExposition.escape("a\"b\\c\nd"));
  }
}
