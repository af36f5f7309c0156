package com.mk.fx.qa.stress.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.stress.aggregate.GlobalAggregator;
import com.mk.fx.qa.stress.aggregate.LivenessMonitor;
import com.mk.fx.qa.stress.export.ConsoleSummaryRenderer;
import com.mk.fx.qa.stress.export.MetricsExposition;
import com.mk.fx.qa.stress.export.ReportFileExporter;
import com.mk.fx.qa.stress.export.RunReportBuilder;
import com.mk.fx.qa.stress.metrics.LocalAggregator;
import com.mk.fx.qa.stress.metrics.OperationRecorder;
import com.mk.fx.qa.stress.metrics.transport.FanOutSnapshotTransport;
import com.mk.fx.qa.stress.metrics.transport.HttpSnapshotTransport;
import com.mk.fx.qa.stress.metrics.transport.InMemorySnapshotTransport;
import com.mk.fx.qa.stress.metrics.transport.SnapshotTransport;
import com.mk.fx.qa.stress.rest.JsonHttpClient;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the metrics pipeline once per process from {@link MetricsSettings}. Components receive
 * their collaborators explicitly; nothing is reached through static state.
 */
@Slf4j
@Configuration
public class MetricsWiringCfg {

  @Bean
  public MetricsSettings metricsSettings(MetricsCfg cfg) {
    MetricsSettings settings = cfg.toSettings();
    log.info(
        "Metrics settings - role {}, worker {}, flush {}ms, silence timeout {}s, {} buckets",
        settings.role(),
        settings.workerId(),
        settings.flushInterval().toMillis(),
        settings.silenceTimeout().toSeconds(),
        settings.buckets().bucketCount());
    return settings;
  }

  @Bean
  public Clock metricsClock() {
    return Clock.systemUTC();
  }

  @Bean
  public OperationRecorder operationRecorder(MetricsSettings settings, Clock clock) {
    return new OperationRecorder(settings.workerId(), settings.buckets(), clock);
  }

  @Bean
  public GlobalAggregator globalAggregator(MetricsSettings settings, Clock clock) {
    return new GlobalAggregator(
        settings.buckets(), new LivenessMonitor(settings.silenceTimeout()), clock);
  }

  @Bean
  public SnapshotTransport snapshotTransport(
      MetricsSettings settings, GlobalAggregator aggregator) {
    var local = new InMemorySnapshotTransport(aggregator::accept);
    return switch (settings.role()) {
      case STANDALONE, COORDINATOR -> local;
      case WORKER -> {
        var client =
            new JsonHttpClient(
                settings.coordinatorUrl(),
                settings.connectTimeout(),
                settings.requestTimeout(),
                Map.of("X-Stress-Worker", settings.workerId()));
        yield new FanOutSnapshotTransport(
            List.of(local, HttpSnapshotTransport.start(client, settings.queueCapacity())));
      }
    };
  }

  @Bean
  public LocalAggregator localAggregator(
      MetricsSettings settings,
      OperationRecorder recorder,
      SnapshotTransport transport,
      Clock clock) {
    return new LocalAggregator(recorder, transport, settings.flushInterval(), clock);
  }

  @Bean
  public MetricsExposition metricsExposition() {
    return new MetricsExposition();
  }

  @Bean
  public ConsoleSummaryRenderer consoleSummaryRenderer() {
    return new ConsoleSummaryRenderer();
  }

  @Bean
  public RunReportBuilder runReportBuilder(MetricsSettings settings) {
    return new RunReportBuilder(settings, UUID.randomUUID().toString());
  }

  @Bean
  public ReportFileExporter reportFileExporter(
      MetricsSettings settings, ObjectMapper objectMapper, Clock clock) {
    return new ReportFileExporter(objectMapper, settings.exportPath(), clock);
  }

  @Bean
  public ExpositionPortCustomizer expositionPortCustomizer(MetricsSettings settings) {
    return new ExpositionPortCustomizer(settings.expositionPort());
  }
}
