package com.mk.fx.qa.stress.export;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.stress.MutableClock;
import com.mk.fx.qa.stress.TestSnapshots;
import com.mk.fx.qa.stress.cfg.ObjectMapperConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportFileExporterTest {

  private final ObjectMapper mapper = new ObjectMapperConfig().objectMapper();
  private final MutableClock clock = new MutableClock(TestSnapshots.T0);

  private static RunReport report(String runId) {
    var r = new RunReport();
    r.runId = runId;
    r.startTime = TestSnapshots.T0;
    r.summary = new RunReport.Summary();
    r.summary.status = "NO_DATA";
    r.summary.highlights = List.of("operations=0");
    return r;
  }

  @Test
  void export_writesJsonAndReplacesPreviousExport(@TempDir Path dir) throws Exception {
    Path target = dir.resolve("out/report.json");
    var exporter = new ReportFileExporter(mapper, target, clock);

    assertTrue(exporter.export(report("first")));
    assertTrue(exporter.export(report("second")));

    JsonNode json = mapper.readTree(target.toFile());
    assertEquals("second", json.get("runId").asText());
    assertEquals("2024-01-01T00:00:00Z", json.get("startTime").asText());
    assertEquals("NO_DATA", json.at("/summary/status").asText());
    assertEquals(2, exporter.getStatus().written());
    assertEquals(TestSnapshots.T0, exporter.getStatus().lastWrittenAt());
    try (Stream<Path> files = Files.list(target.getParent())) {
      assertEquals(1, files.count(), "temp files left behind");
    }
  }

  @Test
  void export_failureIsReportedNotThrown(@TempDir Path dir) throws Exception {
    Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");
    var exporter = new ReportFileExporter(mapper, blocker.resolve("report.json"), clock);

    assertFalse(exporter.export(report("r")));

    assertEquals(0, exporter.getStatus().written());
    assertEquals(1, exporter.getStatus().failures());
    assertNotNull(exporter.getStatus().lastError());
  }

  @Test
  void export_liveReportAfterFinal_isRefusedAndFinalKept(@TempDir Path dir) throws Exception {
    Path target = dir.resolve("report.json");
    var exporter = new ReportFileExporter(mapper, target, clock);
    var done = report("final");
    done.finalReport = true;

    assertTrue(exporter.export(report("live-1")));
    assertTrue(exporter.export(done));
    assertFalse(exporter.export(report("live-2")));

    JsonNode json = mapper.readTree(target.toFile());
    assertEquals("final", json.get("runId").asText());
    assertTrue(json.get("finalReport").asBoolean());
    assertEquals(2, exporter.getStatus().written());
    assertEquals(0, exporter.getStatus().failures());
  }
}
