package com.mk.fx.qa.stress.service;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.stress.TestSettings;
import com.mk.fx.qa.stress.aggregate.GlobalAggregator;
import com.mk.fx.qa.stress.aggregate.LivenessMonitor;
import com.mk.fx.qa.stress.cfg.MetricsSettings;
import com.mk.fx.qa.stress.cfg.ObjectMapperConfig;
import com.mk.fx.qa.stress.export.ConsoleSummaryRenderer;
import com.mk.fx.qa.stress.export.MetricsExposition;
import com.mk.fx.qa.stress.export.ReportFileExporter;
import com.mk.fx.qa.stress.export.RunReport;
import com.mk.fx.qa.stress.export.RunReportBuilder;
import com.mk.fx.qa.stress.metrics.LocalAggregator;
import com.mk.fx.qa.stress.metrics.OperationRecorder;
import com.mk.fx.qa.stress.metrics.transport.InMemorySnapshotTransport;
import com.mk.fx.qa.stress.model.LivenessStatus;
import com.mk.fx.qa.stress.model.OperationType;
import com.mk.fx.qa.stress.model.Outcome;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetricsRunServiceTest {

  @TempDir Path dir;

  private final ObjectMapper mapper = new ObjectMapperConfig().objectMapper();

  private MetricsRunService service;
  private GlobalAggregator aggregator;
  private Path exportPath;

  @BeforeEach
  void setUp() {
    exportPath = dir.resolve("final-report.json");
    MetricsSettings settings = TestSettings.standalone(exportPath);
    service = newService(settings, new ReportFileExporter(mapper, exportPath, Clock.systemUTC()));
    service.start();
  }

  private MetricsRunService newService(MetricsSettings settings, ReportFileExporter exporter) {
    Clock clock = Clock.systemUTC();
    var recorder = new OperationRecorder(settings.workerId(), settings.buckets(), clock);
    aggregator =
        new GlobalAggregator(
            settings.buckets(), new LivenessMonitor(settings.silenceTimeout()), clock);
    var transport = new InMemorySnapshotTransport(aggregator::accept);
    return new MetricsRunService(
        settings,
        recorder,
        new LocalAggregator(recorder, transport, Duration.ofMinutes(1), clock),
        transport,
        aggregator,
        new MetricsExposition(),
        new ConsoleSummaryRenderer(),
        new RunReportBuilder(settings, "run-42"),
        exporter);
  }

  @AfterEach
  void tearDown() {
    service.stop();
  }

  @Test
  void stop_flushesRecordedOperationsIntoFinalReport() throws Exception {
    for (int i = 0; i < 20; i++) {
      service
          .recorder()
          .record(OperationType.UPLOAD, 4096, Duration.ofMillis(3), Outcome.SUCCESS, null);
    }
    service
        .recorder()
        .record(OperationType.DOWNLOAD, 0, Duration.ofMillis(8), Outcome.FAILURE, "SlowDown");

    RunReport report = service.stop();

    assertTrue(service.isStopped());
    assertTrue(report.finalReport);
    assertEquals("run-42", report.runId);
    assertEquals(21, report.combined.count());
    assertEquals(20 * 4096L, report.combined.bytes());
    assertEquals("PARTIAL_SUCCESS", report.summary.status);
    assertEquals(1, report.completeness.finishedWorkers);
    assertEquals(LivenessStatus.FINISHED, report.workers.get(0).status());
    assertTrue(aggregator.isFinalized());
  }

  @Test
  void stop_writesReportFile() throws Exception {
    service
        .recorder()
        .record(OperationType.HEAD, 0, Duration.ofMillis(1), Outcome.SUCCESS, null);

    service.stop();

    assertTrue(Files.exists(exportPath));
    JsonNode json = mapper.readTree(exportPath.toFile());
    assertEquals("run-42", json.get("runId").asText());
    assertEquals("SUCCESS", json.get("summary").get("status").asText());
    assertEquals(1, service.exportStatus().written());
  }

  @Test
  void stop_isIdempotent() {
    RunReport first = service.stop();
    RunReport second = service.stop();

    assertSame(first, second);
    assertEquals("NO_DATA", first.summary.status);
    assertSame(first, service.currentReport());
  }

  @Test
  void currentReport_beforeStop_isLive() {
    service
        .recorder()
        .record(OperationType.LIST, 0, Duration.ofMillis(2), Outcome.SUCCESS, null);

    RunReport live = service.currentReport();

    assertFalse(live.finalReport);
    assertFalse(service.isStopped());
    assertTrue(service.exposition().contains("stress_workers"));
  }

  @Test
  void stop_inFlightPeriodicExport_neverOverwritesFinalReport() throws Exception {
    service.stop();
    Path target = dir.resolve("periodic-report.json");
    var liveExportStarted = new CountDownLatch(1);
    var exporter =
        new ReportFileExporter(mapper, target, Clock.systemUTC()) {
          @Override
          public boolean export(RunReport report) {
            if (!report.finalReport) {
              liveExportStarted.countDown();
              try {
                Thread.sleep(300);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            }
            return super.export(report);
          }
        };
    var settings =
        TestSettings.standalone(target).toBuilder().exportInterval(Duration.ofMillis(20)).build();
    service = newService(settings, exporter);
    service.start();
    assertTrue(liveExportStarted.await(5, TimeUnit.SECONDS));

    service.stop();
    Thread.sleep(400);

    JsonNode json = mapper.readTree(target.toFile());
    assertTrue(json.get("finalReport").asBoolean());
    assertEquals("run-42", json.get("runId").asText());
  }

  @Test
  void stop_withoutStart_skipsExport() throws Exception {
    service.stop();
    Path target = dir.resolve("never-started.json");
    service =
        newService(
            TestSettings.standalone(target),
            new ReportFileExporter(mapper, target, Clock.systemUTC()));

    RunReport report = service.stop();

    assertFalse(service.isStarted());
    assertTrue(service.isStopped());
    assertNotNull(report);
    assertFalse(Files.exists(target));
    assertEquals(0, service.exportStatus().written());
  }

  @Test
  void start_afterStop_doesNotRestart() {
    service.stop();

    service.start();

    assertTrue(service.isStopped());
    assertEquals(1, service.exportStatus().written());
  }
}
