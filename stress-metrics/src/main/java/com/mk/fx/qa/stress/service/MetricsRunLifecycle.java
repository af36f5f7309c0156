package com.mk.fx.qa.stress.service;

import lombok.RequiredArgsConstructor;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the run once the web server is up and stops it before the server stops, so snapshot
 * ingestion stays open for the whole final wait.
 */
@Component
@RequiredArgsConstructor
public class MetricsRunLifecycle implements SmartLifecycle {

  private final MetricsRunService runService;
  private volatile boolean running;

  @Override
  public void start() {
    runService.start();
    running = true;
  }

  @Override
  public void stop() {
    try {
      runService.stop();
    } finally {
      running = false;
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  // Web server lifecycles use lower phases, so this stops first and starts last
  @Override
  public int getPhase() {
    return SmartLifecycle.DEFAULT_PHASE;
  }
}
