package com.mk.fx.qa.stress.service;

import com.mk.fx.qa.stress.aggregate.GlobalAggregator;
import com.mk.fx.qa.stress.aggregate.GlobalSummary;
import com.mk.fx.qa.stress.aggregate.WorkerState;
import com.mk.fx.qa.stress.cfg.MetricsSettings;
import com.mk.fx.qa.stress.export.ConsoleSummaryRenderer;
import com.mk.fx.qa.stress.export.ExportStatus;
import com.mk.fx.qa.stress.export.MetricsExposition;
import com.mk.fx.qa.stress.export.ReportFileExporter;
import com.mk.fx.qa.stress.export.RunReport;
import com.mk.fx.qa.stress.export.RunReportBuilder;
import com.mk.fx.qa.stress.metrics.LocalAggregator;
import com.mk.fx.qa.stress.metrics.OperationRecorder;
import com.mk.fx.qa.stress.metrics.Recorder;
import com.mk.fx.qa.stress.metrics.transport.SnapshotTransport;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the lifecycle of one run's metrics pipeline.
 *
 * <p>On start the local aggregator begins flushing (when this process records), liveness is
 * re-evaluated periodically and, if enabled, the report is exported at intervals. On stop the
 * local aggregator flushes its final snapshot, the global aggregator waits a bounded grace period
 * for final snapshots, and the final report is exported and summarised in the log. Export failures
 * are logged and never interrupt the run.
 *
 * <p>Driven by {@link MetricsRunLifecycle}, which stops the run before the web server so a
 * coordinator keeps ingesting final snapshots while it waits for them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsRunService {

  private final MetricsSettings settings;
  private final OperationRecorder recorder;
  private final LocalAggregator localAggregator;
  private final SnapshotTransport transport;
  private final GlobalAggregator aggregator;
  private final MetricsExposition exposition;
  private final ConsoleSummaryRenderer consoleRenderer;
  private final RunReportBuilder reportBuilder;
  private final ReportFileExporter exporter;

  private ScheduledExecutorService housekeeping;
  private volatile boolean started;
  private volatile boolean stopping;
  private volatile RunReport finalReport;

  public synchronized void start() {
    if (started || finalReport != null) return;
    log.info(
        "Starting metrics pipeline - role {}, worker {}, export to {}",
        settings.role(),
        settings.workerId(),
        exporter.getTarget());
    if (settings.role().records()) {
      localAggregator.start();
    }
    housekeeping =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("metrics-housekeeping");
              t.setDaemon(true);
              return t;
            });
    long livenessMs = settings.livenessCheckInterval().toMillis();
    housekeeping.scheduleWithFixedDelay(
        this::refreshLiveness, livenessMs, livenessMs, TimeUnit.MILLISECONDS);
    if (settings.periodicExportEnabled()) {
      long exportMs = settings.exportInterval().toMillis();
      housekeeping.scheduleWithFixedDelay(
          this::periodicExport, exportMs, exportMs, TimeUnit.MILLISECONDS);
    }
    started = true;
  }

  public boolean isStarted() {
    return started;
  }

  /**
   * Stops the run: final flush, bounded wait for final snapshots, final export. Later calls return
   * the same report. A run that never started is closed without writing an export.
   */
  public synchronized RunReport stop() {
    if (finalReport != null) return finalReport;
    stopping = true;
    stopHousekeeping();

    if (!started) {
      log.warn("Run was never started, skipping final export to {}", exporter.getTarget());
      transport.close();
      finalReport = reportBuilder.build(aggregator.summary());
      return finalReport;
    }
    log.info("Stop requested, finalizing run within {}ms", settings.shutdownGrace().toMillis());
    if (settings.role().records()) {
      localAggregator.stop(settings.shutdownGrace());
    }
    GlobalSummary summary =
        aggregator.finalizeRun(settings.shutdownGrace(), settings.expectedWorkers());
    RunReport report = reportBuilder.build(summary);
    exporter.export(report);
    log.info("\n{}", consoleRenderer.render(summary, report.summary.status));
    transport.close();
    finalReport = report;
    return report;
  }

  private void stopHousekeeping() {
    if (housekeeping == null) return;
    housekeeping.shutdownNow();
    try {
      if (!housekeeping.awaitTermination(
          settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Housekeeping tasks still running after {}", settings.shutdownGrace());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public boolean isStopped() {
    return finalReport != null;
  }

  /** Handle the workload layer records operations through. */
  public Recorder recorder() {
    return recorder;
  }

  public GlobalSummary summary() {
    return aggregator.summary();
  }

  public List<WorkerState> workers() {
    return aggregator.workers();
  }

  public String exposition() {
    return exposition.render(aggregator.summary());
  }

  /** The final report once stopped, otherwise a live report of the current state. */
  public RunReport currentReport() {
    RunReport done = finalReport;
    return done != null ? done : reportBuilder.build(aggregator.summary());
  }

  public ExportStatus exportStatus() {
    return exporter.getStatus();
  }

  private void refreshLiveness() {
    try {
      aggregator.refreshLiveness();
    } catch (RuntimeException e) {
      log.error("Liveness check failed", e);
    }
  }

  private void periodicExport() {
    if (stopping) return;
    try {
      if (!exporter.export(reportBuilder.build(aggregator.summary()))) {
        log.warn("Periodic export failed, retrying in {}s", settings.exportInterval().toSeconds());
      }
    } catch (RuntimeException e) {
      log.warn("Periodic export failed, retrying in {}s", settings.exportInterval().toSeconds(), e);
    }
  }
}
