package com.mk.fx.qa.stress.resource;

import com.mk.fx.qa.stress.cfg.MetricsSettings;
import com.mk.fx.qa.stress.dto.HealthResponse;
import com.mk.fx.qa.stress.dto.StopResponse;
import com.mk.fx.qa.stress.export.RunReport;
import com.mk.fx.qa.stress.service.MetricsRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Run", description = "Run control and service health")
@RestController
@RequestMapping("/api/run")
@RequiredArgsConstructor
public class RunController {

  private final MetricsRunService runService;
  private final MetricsSettings settings;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Stop the run",
      description = "Final flush, bounded wait for final snapshots, final export.")
  @PostMapping("/stop")
  public ResponseEntity<StopResponse> stop() {
    log.info("Stop requested over HTTP");
    RunReport report = runService.stop();
    return responseFactory.ok(
        new StopResponse(
            report.runId,
            report.summary.status,
            report.combined.count(),
            report.completeness.staleWorkers,
            settings.exportPath().toString()));
  }

  @Operation(summary = "Health check", description = "Returns service status.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> healthy() {
    return responseFactory.ok(new HealthResponse("UP", settings.role(), runService.isStopped()));
  }
}
