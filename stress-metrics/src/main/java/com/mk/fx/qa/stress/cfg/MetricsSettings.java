package com.mk.fx.qa.stress.cfg;

import com.mk.fx.qa.stress.metrics.LatencyBuckets;
import com.mk.fx.qa.stress.model.RunRole;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable, validated settings every metrics component is built from. Produced once at startup by
 * {@link MetricsCfg#toSettings()}.
 */
@Builder(toBuilder = true)
public record MetricsSettings(
    RunRole role,
    String workerId,
    Duration flushInterval,
    LatencyBuckets buckets,
    String coordinatorUrl,
    int expositionPort,
    Path exportPath,
    Duration exportInterval,
    Duration silenceTimeout,
    Duration livenessCheckInterval,
    int queueCapacity,
    Duration shutdownGrace,
    int expectedWorkers,
    Duration connectTimeout,
    Duration requestTimeout,
    RunMetadata run) {

  public MetricsSettings {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(buckets, "buckets");
    Objects.requireNonNull(exportPath, "exportPath");
    if (workerId == null || workerId.isBlank()) {
      throw new IllegalArgumentException("workerId must not be blank");
    }
    if (role == RunRole.WORKER && (coordinatorUrl == null || coordinatorUrl.isBlank())) {
      throw new IllegalArgumentException("coordinatorUrl is required for role WORKER");
    }
    requirePositive(flushInterval, "flushInterval");
    requirePositive(silenceTimeout, "silenceTimeout");
    requirePositive(livenessCheckInterval, "livenessCheckInterval");
    requirePositive(connectTimeout, "connectTimeout");
    requirePositive(requestTimeout, "requestTimeout");
    requireNonNegative(exportInterval, "exportInterval");
    requireNonNegative(shutdownGrace, "shutdownGrace");
    if (expositionPort < 0 || expositionPort > 65535) {
      throw new IllegalArgumentException("expositionPort out of range: " + expositionPort);
    }
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be at least 1");
    }
    if (expectedWorkers < 0) {
      throw new IllegalArgumentException("expectedWorkers must not be negative");
    }
    run = run == null ? RunMetadata.none() : run;
  }

  public boolean periodicExportEnabled() {
    return !exportInterval.isZero();
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }

  private static void requireNonNegative(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative, got " + value);
    }
  }
}
