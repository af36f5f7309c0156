package com.mk.fx.qa.stress.resource;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.stress.TestSettings;
import com.mk.fx.qa.stress.TestSnapshots;
import com.mk.fx.qa.stress.aggregate.OperationSummary;
import com.mk.fx.qa.stress.cfg.MetricsSettings;
import com.mk.fx.qa.stress.export.RunReport;
import com.mk.fx.qa.stress.service.MetricsRunService;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = RunController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class})
class RunControllerTest {

  @TestConfiguration
  static class SettingsConfig {
    @Bean
    MetricsSettings metricsSettings() {
      return TestSettings.standalone(Path.of("final-report.json"));
    }
  }

  @Autowired MockMvc mvc;

  @MockBean MetricsRunService runService;

  @Test
  void stop_returnsVerdictAndExportPath() throws Exception {
    var report = new RunReport();
    report.runId = "run-1";
    report.summary = new RunReport.Summary();
    report.summary.status = "SUCCESS";
    report.combined =
        OperationSummary.from(
            "all", TestSnapshots.totals(12, 12, 0, 100), TestSnapshots.BUCKETS, 1.0);
    report.completeness = new RunReport.Completeness();
    report.completeness.staleWorkers = 1;
    when(runService.stop()).thenReturn(report);

    mvc.perform(post("/api/run/stop"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.runId").value("run-1"))
        .andExpect(jsonPath("$.status").value("SUCCESS"))
        .andExpect(jsonPath("$.operations").value(12))
        .andExpect(jsonPath("$.staleWorkers").value(1))
        .andExpect(jsonPath("$.exportPath").value("final-report.json"));
  }

  @Test
  void healthy_reportsRoleAndFinalization() throws Exception {
    when(runService.isStopped()).thenReturn(false);

    mvc.perform(get("/api/run/healthy"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.role").value("STANDALONE"))
        .andExpect(jsonPath("$.finalized").value(false));
  }

  @Test
  void stop_whenLifecycleMisused_mapsTo409() throws Exception {
    when(runService.stop()).thenThrow(new IllegalStateException("already stopping"));

    mvc.perform(post("/api/run/stop"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("Conflict"));
  }
}
