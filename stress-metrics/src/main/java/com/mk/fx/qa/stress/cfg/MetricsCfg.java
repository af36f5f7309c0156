package com.mk.fx.qa.stress.cfg;

import com.mk.fx.qa.stress.metrics.LatencyBuckets;
import com.mk.fx.qa.stress.metrics.RunEnvironment;
import com.mk.fx.qa.stress.model.RunRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Binds {@code stress.metrics.*}; see {@link MetricsSettings} for the validated form. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "stress.metrics")
public class MetricsCfg {

  @NotNull private RunRole role = RunRole.STANDALONE;

  /** Defaults to {@code <host>-<pid>} when blank. */
  private String workerId;

  @NotNull private Duration flushInterval = Duration.ofSeconds(5);

  @NotEmpty
  private List<Long> bucketBoundariesMicros = new ArrayList<>(LatencyBuckets.defaults().asList());

  @NotBlank private String coordinatorUrl = "http://localhost:8090";

  @Min(0)
  @Max(65535)
  private int expositionPort = 8090;

  @NotBlank private String exportPath = "stress-metrics-report.json";

  /** Zero disables periodic export; the final export is always written. */
  @NotNull private Duration exportInterval = Duration.ZERO;

  @NotNull private Duration silenceTimeout = Duration.ofSeconds(30);

  @NotNull private Duration livenessCheckInterval = Duration.ofSeconds(1);

  @Min(1)
  @Max(1024)
  private int queueCapacity = 16;

  @NotNull private Duration shutdownGrace = Duration.ofSeconds(10);

  /** Zero means unknown: the coordinator only waits for workers it has already seen. */
  @Min(0)
  private int expectedWorkers = 0;

  @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

  @NotNull private Duration requestTimeout = Duration.ofSeconds(5);

  @Valid @NotNull private Run run = new Run();

  @Data
  public static class Run {
    private String scenario;
    private String targetEndpoint;
    private String driver;
    private Map<String, String> parameters = new LinkedHashMap<>();
  }

  /**
   * Validates cross-field rules and freezes the configuration.
   *
   * @throws IllegalArgumentException if the configuration is inconsistent
   */
  public MetricsSettings toSettings() {
    return MetricsSettings.builder()
        .role(role)
        .workerId(
            workerId == null || workerId.isBlank() ? RunEnvironment.defaultWorkerId() : workerId)
        .flushInterval(flushInterval)
        .buckets(LatencyBuckets.of(bucketBoundariesMicros))
        .coordinatorUrl(coordinatorUrl)
        .expositionPort(expositionPort)
        .exportPath(Path.of(exportPath))
        .exportInterval(exportInterval)
        .silenceTimeout(silenceTimeout)
        .livenessCheckInterval(livenessCheckInterval)
        .queueCapacity(queueCapacity)
        .shutdownGrace(shutdownGrace)
        .expectedWorkers(expectedWorkers)
        .connectTimeout(connectTimeout)
        .requestTimeout(requestTimeout)
        .run(
            new RunMetadata(
                run.getScenario(), run.getTargetEndpoint(), run.getDriver(), run.getParameters()))
        .build();
  }
}
