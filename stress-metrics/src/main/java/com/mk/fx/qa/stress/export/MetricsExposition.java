package com.mk.fx.qa.stress.export;

import com.mk.fx.qa.stress.aggregate.GlobalSummary;
import com.mk.fx.qa.stress.aggregate.OperationSummary;
import com.mk.fx.qa.stress.aggregate.WorkerState;
import com.mk.fx.qa.stress.model.LivenessStatus;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link GlobalSummary} in the plain-text exposition format scraped by pull-based
 * monitoring. Counters and histogram buckets are cumulative; latency is exposed in seconds.
 */
public class MetricsExposition {

  public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

  private static final String PREFIX = "stress_";

  public String render(GlobalSummary summary) {
    Objects.requireNonNull(summary, "summary");
    var out = new StringBuilder(4096);

    header(out, "operations_total", "counter", "Completed operations by type and outcome.");
    for (OperationSummary op : summary.operations()) {
      String name = op.operation();
      sample(
          out,
          "operations_total",
          labels("operation", name, "outcome", "success"),
          op.successCount());
      sample(
          out,
          "operations_total",
          labels("operation", name, "outcome", "failure"),
          op.failureCount());
    }

    header(out, "operation_bytes_total", "counter", "Bytes moved by successful operations.");
    for (OperationSummary op : summary.operations()) {
      sample(out, "operation_bytes_total", labels("operation", op.operation()), op.bytes());
    }

    header(out, "operation_latency_seconds", "histogram", "Operation latency.");
    List<Long> bounds = summary.bucketBoundariesMicros();
    for (OperationSummary op : summary.operations()) {
      String name = op.operation();
      long cumulative = 0;
      List<Long> counts = op.latencyBucketCounts();
      for (int i = 0; i < counts.size(); i++) {
        cumulative += counts.get(i);
        String le = i < bounds.size() ? seconds(bounds.get(i)) : "+Inf";
        sample(
            out,
            "operation_latency_seconds_bucket",
            labels("operation", name, "le", le),
            cumulative);
      }
      out.append(PREFIX)
          .append("operation_latency_seconds_sum")
          .append(labels("operation", name))
          .append(' ')
          .append(seconds(op.latencySumMicros()))
          .append('\n');
      sample(out, "operation_latency_seconds_count", labels("operation", name), op.count());
    }

    header(out, "operation_failures_total", "counter", "Failed operations by failure kind.");
    for (OperationSummary op : summary.operations()) {
      for (Map.Entry<String, Long> kind : op.failureKinds().entrySet()) {
        String kindLabels = labels("operation", op.operation(), "kind", kind.getKey());
        sample(out, "operation_failures_total", kindLabels, kind.getValue());
      }
    }

    header(out, "workers", "gauge", "Known workers by liveness status.");
    sample(out, "workers", statusLabel(LivenessStatus.ACTIVE), summary.activeWorkers());
    sample(out, "workers", statusLabel(LivenessStatus.STALE), summary.staleWorkers());
    sample(out, "workers", statusLabel(LivenessStatus.FINISHED), summary.finishedWorkers());

    header(out, "worker_up", "gauge", "1 unless the worker has gone stale.");
    for (WorkerState worker : summary.workers()) {
      String status = worker.status().name().toLowerCase(Locale.ROOT);
      long up = worker.status() == LivenessStatus.STALE ? 0 : 1;
      sample(out, "worker_up", labels("worker", worker.workerId(), "status", status), up);
    }

    header(out, "worker_heap_used_bytes", "gauge", "Heap in use at the worker's last snapshot.");
    for (WorkerState worker : summary.workers()) {
      if (worker.resources() == null) continue;
      sample(
          out,
          "worker_heap_used_bytes",
          labels("worker", worker.workerId()),
          worker.resources().heapUsedBytes());
    }
    header(out, "worker_heap_peak_bytes", "gauge", "Highest heap use the worker has sampled.");
    for (WorkerState worker : summary.workers()) {
      if (worker.resources() == null) continue;
      sample(
          out,
          "worker_heap_peak_bytes",
          labels("worker", worker.workerId()),
          worker.resources().heapPeakBytes());
    }
    header(out, "worker_cpu_load", "gauge", "Process CPU load of the worker, 0 to 1.");
    for (WorkerState worker : summary.workers()) {
      if (worker.resources() == null) continue;
      out.append(PREFIX)
          .append("worker_cpu_load")
          .append(labels("worker", worker.workerId()))
          .append(' ')
          .append(format(worker.resources().processCpuLoad()))
          .append('\n');
    }
    header(out, "worker_threads", "gauge", "Live JVM threads of the worker.");
    for (WorkerState worker : summary.workers()) {
      if (worker.resources() == null) continue;
      sample(
          out,
          "worker_threads",
          labels("worker", worker.workerId()),
          worker.resources().liveThreads());
    }

    header(out, "snapshots_dropped_total", "counter", "Snapshots workers failed to deliver.");
    sample(out, "snapshots_dropped_total", "", summary.droppedSnapshots());
    header(out, "snapshots_rejected_total", "counter", "Snapshots refused as incompatible.");
    sample(out, "snapshots_rejected_total", "", summary.rejectedSnapshots());
    header(out, "records_invalid_total", "counter", "Operation records discarded as invalid.");
    sample(out, "records_invalid_total", "", summary.invalidRecords());
    header(out, "summary_stale_contributions", "gauge", "1 when totals include stale workers.");
    sample(out, "summary_stale_contributions", "", summary.staleContributions() ? 1 : 0);
    header(out, "run_elapsed_seconds", "gauge", "Wall-clock time since the run started.");
    out.append(PREFIX)
        .append("run_elapsed_seconds ")
        .append(format(summary.elapsedSeconds()))
        .append('\n');
    return out.toString();
  }

  private static void header(StringBuilder out, String name, String type, String help) {
    out.append("# HELP ").append(PREFIX).append(name).append(' ').append(help).append('\n');
    out.append("# TYPE ").append(PREFIX).append(name).append(' ').append(type).append('\n');
  }

  private static void sample(StringBuilder out, String name, String labels, long value) {
    out.append(PREFIX).append(name).append(labels).append(' ').append(value).append('\n');
  }

  private static String labels(String... pairs) {
    var sb = new StringBuilder("{");
    for (int i = 0; i < pairs.length; i += 2) {
      if (i > 0) sb.append(',');
      sb.append(pairs[i]).append("=\"").append(escape(pairs[i + 1])).append('"');
    }
    return sb.append('}').toString();
  }

  static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
  }

  private static String statusLabel(LivenessStatus status) {
    return labels("status", status.name().toLowerCase(Locale.ROOT));
  }

  private static String seconds(long micros) {
    return format(micros / 1_000_000.0);
  }

  private static String format(double value) {
    String s = String.format(Locale.ROOT, "%.6f", value);
    s = s.replaceAll("0+$", "");
    return s.endsWith(".") ? s + "0" : s;
  }
}
