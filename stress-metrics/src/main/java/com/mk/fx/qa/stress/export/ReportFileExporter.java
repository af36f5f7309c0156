package com.mk.fx.qa.stress.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the {@link RunReport} as JSON. The document is written to a sibling temp file first and
 * moved into place, so readers never see a half-written export.
 */
@Slf4j
public class ReportFileExporter {

  private final ObjectMapper mapper;
  private final Path target;
  private final Clock clock;
  private volatile ExportStatus status = ExportStatus.none();
  private boolean finalWritten;

  public ReportFileExporter(ObjectMapper mapper, Path target, Clock clock) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Path getTarget() {
    return target;
  }

  public ExportStatus getStatus() {
    return status;
  }

  /**
   * Writes the report, replacing any previous export. Once a final report has been written, live
   * reports are refused so the final one stays in place.
   *
   * @return false if the write failed or was refused; failures are logged and kept in {@link
   *     #getStatus()}
   */
  public synchronized boolean export(RunReport report) {
    Objects.requireNonNull(report, "report");
    if (finalWritten && !report.finalReport) {
      log.debug("Skipping live report, final report already written to {}", target);
      return false;
    }
    Path tmp = null;
    try {
      Path dir = target.getParent();
      if (dir != null) Files.createDirectories(dir);
      tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
      mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), report);
      try {
        Files.move(
            tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      status = new ExportStatus(status.written() + 1, status.failures(), clock.instant(), null);
      finalWritten |= report.finalReport;
      log.info("Run report written to {}", target);
      return true;
    } catch (IOException e) {
      status =
          new ExportStatus(
              status.written(), status.failures() + 1, status.lastWrittenAt(), e.toString());
      log.error("Failed to write run report to {}", target, e);
      deleteQuietly(tmp);
      return false;
    }
  }

  private static void deleteQuietly(Path tmp) {
    if (tmp == null) return;
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.debug("Could not remove temp file {}", tmp, e);
    }
  }
}
