package com.mk.fx.qa.stress.export;

import com.mk.fx.qa.stress.aggregate.GlobalSummary;
import com.mk.fx.qa.stress.aggregate.OperationSummary;
import java.util.Locale;

/** End-of-run table, one row per operation type that saw traffic plus a combined row. */
public class ConsoleSummaryRenderer {

  private static final String ROW = "%-10s %10s %9s %10s %10s %10s %12s %10s%n";
  private static final double MIB = 1024.0 * 1024.0;

  public String render(GlobalSummary summary, String verdict) {
    var sb = new StringBuilder();
    sb.append(
        String.format(
            Locale.ROOT,
            "Run summary - %.1fs elapsed, %d worker(s) (%d active, %d stale, %d finished)%s%n",
            summary.elapsedSeconds(),
            summary.workers().size(),
            summary.activeWorkers(),
            summary.staleWorkers(),
            summary.finishedWorkers(),
            summary.staleContributions() ? ", INCLUDES STALE DATA" : ""));
    sb.append(
        String.format(
            Locale.ROOT,
            ROW,
            "Operation",
            "Count",
            "Success%",
            "p50(ms)",
            "p95(ms)",
            "p99(ms)",
            "Thru(MiB/s)",
            "Ops/s"));
    for (OperationSummary op : summary.operations()) {
      if (op.count() > 0) row(sb, op);
    }
    row(sb, summary.combined());
    if (summary.droppedSnapshots() > 0
        || summary.rejectedSnapshots() > 0
        || summary.invalidRecords() > 0) {
      sb.append(
          String.format(
              Locale.ROOT,
              "Dropped snapshots: %d, rejected snapshots: %d, invalid records: %d%n",
              summary.droppedSnapshots(),
              summary.rejectedSnapshots(),
              summary.invalidRecords()));
    }
    if (verdict != null) sb.append("Verdict: ").append(verdict).append(System.lineSeparator());
    return sb.toString();
  }

  private static void row(StringBuilder sb, OperationSummary op) {
    sb.append(
        String.format(
            Locale.ROOT,
            ROW,
            op.operation(),
            op.count(),
            op.count() == 0 ? "-" : String.format(Locale.ROOT, "%.2f", op.successRate() * 100),
            millis(op.p50Ms()),
            millis(op.p95Ms()),
            millis(op.p99Ms()),
            String.format(Locale.ROOT, "%.2f", op.throughputBytesPerSec() / MIB),
            String.format(Locale.ROOT, "%.1f", op.opsPerSec())));
  }

  private static String millis(Double value) {
    return value == null ? "-" : String.format(Locale.ROOT, "%.2f", value);
  }
}
