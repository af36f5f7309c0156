package com.mk.fx.qa.stress.export;

import com.mk.fx.qa.stress.aggregate.GlobalSummary;
import com.mk.fx.qa.stress.aggregate.OperationSummary;
import com.mk.fx.qa.stress.cfg.MetricsSettings;
import com.mk.fx.qa.stress.cfg.RunMetadata;
import com.mk.fx.qa.stress.metrics.RunEnvironment;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Objects;

/** Assembles a {@link RunReport} from a summary and the run's settings. */
public class RunReportBuilder {

  static final double PARTIAL_SUCCESS_THRESHOLD = 0.95;

  private final MetricsSettings settings;
  private final String runId;

  public RunReportBuilder(MetricsSettings settings, String runId) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.runId = Objects.requireNonNull(runId, "runId");
  }

  public RunReport build(GlobalSummary summary) {
    var r = new RunReport();

    r.runId = runId;
    r.role = settings.role();
    r.startTime = summary.startedAt();
    r.endTime = summary.generatedAt();
    r.durationSec = summary.elapsedSeconds();
    r.finalReport = summary.finalSummary();

    var env = new RunReport.EnvInfo();
    env.host = RunEnvironment.host();
    env.triggeredBy = RunEnvironment.triggeredBy();
    env.workerId = settings.role().records() ? settings.workerId() : null;
    r.environment = env;

    var cfg = new RunReport.Config();
    cfg.flushInterval = settings.flushInterval();
    cfg.silenceTimeout = settings.silenceTimeout();
    cfg.queueCapacity = settings.queueCapacity();
    cfg.expectedWorkers = settings.expectedWorkers();
    cfg.bucketBoundariesMicros = summary.bucketBoundariesMicros();
    r.config = cfg;

    RunMetadata run = settings.run();
    var workload = new RunReport.Workload();
    workload.scenario = run.scenario();
    workload.targetEndpoint = run.targetEndpoint();
    workload.driver = run.driver();
    workload.parameters = run.parameters();
    r.workload = workload;

    r.operations = summary.operations();
    r.combined = summary.combined();
    r.workers = summary.workers();

    var c = new RunReport.Completeness();
    c.staleContributions = summary.staleContributions();
    c.activeWorkers = summary.activeWorkers();
    c.staleWorkers = summary.staleWorkers();
    c.finishedWorkers = summary.finishedWorkers();
    c.droppedSnapshots = summary.droppedSnapshots();
    c.rejectedSnapshots = summary.rejectedSnapshots();
    c.invalidRecords = summary.invalidRecords();
    r.completeness = c;

    r.summary = computeSummary(summary);
    return r;
  }

  private RunReport.Summary computeSummary(GlobalSummary summary) {
    var s = new RunReport.Summary();
    OperationSummary all = summary.combined();
    String status;
    if (all.count() == 0) {
      status = "NO_DATA";
    } else if (all.successRate() >= 1.0) {
      status = "SUCCESS";
    } else if (all.successRate() >= PARTIAL_SUCCESS_THRESHOLD) {
      status = "PARTIAL_SUCCESS";
    } else {
      status = "FAILED";
    }
    s.status = status;
    s.message =
        switch (status) {
          case "NO_DATA" -> "No operations were recorded.";
          case "SUCCESS" -> "All operations succeeded with no failures.";
          case "PARTIAL_SUCCESS" -> "Minor failures observed; overall run largely successful.";
          default -> "Failures observed; review failure kinds per operation.";
        };
    s.highlights = new ArrayList<>();
    s.concerns = new ArrayList<>();

    s.highlights.add("operations=" + all.count());
    if (all.count() > 0) {
      s.highlights.add(String.format(Locale.ROOT, "successRate=%.2f%%", all.successRate() * 100));
    }
    if (all.p95Ms() != null) {
      s.highlights.add(String.format(Locale.ROOT, "latency.p95=%.2fms", all.p95Ms()));
    }
    if (all.bytes() > 0) {
      s.highlights.add(
          String.format(
              Locale.ROOT, "throughput=%.2fMiB/s", all.throughputBytesPerSec() / (1024 * 1024)));
    }
    s.highlights.add("workers=" + summary.workers().size());

    if (all.failureCount() > 0) s.concerns.add("failures=" + all.failureCount());
    if (summary.staleWorkers() > 0) s.concerns.add("staleWorkers=" + summary.staleWorkers());
    if (summary.droppedSnapshots() > 0) {
      s.concerns.add("droppedSnapshots=" + summary.droppedSnapshots());
    }
    if (summary.rejectedSnapshots() > 0) {
      s.concerns.add("rejectedSnapshots=" + summary.rejectedSnapshots());
    }
    if (summary.invalidRecords() > 0) s.concerns.add("invalidRecords=" + summary.invalidRecords());
    if (settings.expectedWorkers() > summary.workers().size()) {
      s.concerns.add(
          "missingWorkers=" + (settings.expectedWorkers() - summary.workers().size()));
    }
    return s;
  }
}
