package com.mk.fx.qa.stress.cfg;

import java.util.Map;

/** Workload description copied verbatim into the run report. */
public record RunMetadata(
    String scenario, String targetEndpoint, String driver, Map<String, String> parameters) {

  public RunMetadata {
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }

  public static RunMetadata none() {
    return new RunMetadata(null, null, null, Map.of());
  }
}
