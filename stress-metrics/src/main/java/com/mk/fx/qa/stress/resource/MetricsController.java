package com.mk.fx.qa.stress.resource;

import com.mk.fx.qa.stress.aggregate.GlobalSummary;
import com.mk.fx.qa.stress.aggregate.WorkerState;
import com.mk.fx.qa.stress.export.MetricsExposition;
import com.mk.fx.qa.stress.export.RunReport;
import com.mk.fx.qa.stress.service.MetricsRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Metrics", description = "Read-only views of the merged run metrics")
@RestController
@RequiredArgsConstructor
public class MetricsController {

  private final MetricsRunService runService;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Scrape metrics",
      description = "Cumulative counters and latency histograms in text exposition format.")
  @GetMapping("/metrics")
  public ResponseEntity<String> scrape() {
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_TYPE, MetricsExposition.CONTENT_TYPE)
        .body(runService.exposition());
  }

  @Operation(summary = "Merged summary", description = "Current merged view across all workers.")
  @GetMapping("/api/metrics/summary")
  public ResponseEntity<GlobalSummary> summary() {
    return responseFactory.ok(runService.summary());
  }

  @Operation(summary = "Worker liveness", description = "Last report and status of every worker.")
  @GetMapping("/api/metrics/workers")
  public ResponseEntity<List<WorkerState>> workers() {
    return responseFactory.ok(runService.workers());
  }

  @Operation(
      summary = "Run report",
      description = "The final report once the run is stopped, a live one before that.")
  @GetMapping("/api/metrics/report")
  public ResponseEntity<RunReport> report() {
    return responseFactory.ok(runService.currentReport());
  }
}
