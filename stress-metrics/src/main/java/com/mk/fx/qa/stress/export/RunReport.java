package com.mk.fx.qa.stress.export;

import com.mk.fx.qa.stress.aggregate.OperationSummary;
import com.mk.fx.qa.stress.aggregate.WorkerState;
import com.mk.fx.qa.stress.model.RunRole;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Structured export document: run metadata, merged totals, worker liveness and completeness. */
public class RunReport {

  public String runId;
  public RunRole role;
  public Instant startTime;
  public Instant endTime;
  public double durationSec;
  public boolean finalReport;

  public EnvInfo environment;
  public Config config;
  public Workload workload;

  public List<OperationSummary> operations;
  public OperationSummary combined;
  public List<WorkerState> workers;
  public Completeness completeness;
  public Summary summary;

  public static class EnvInfo {
    public String host;
    public String triggeredBy;
    public String workerId;
  }

  public static class Config {
    public Duration flushInterval;
    public Duration silenceTimeout;
    public int queueCapacity;
    public int expectedWorkers;
    public List<Long> bucketBoundariesMicros;
  }

  public static class Workload {
    public String scenario;
    public String targetEndpoint;
    public String driver;
    public Map<String, String> parameters;
  }

  public static class Completeness {
    public boolean staleContributions;
    public int activeWorkers;
    public int staleWorkers;
    public int finishedWorkers;
    public long droppedSnapshots;
    public long rejectedSnapshots;
    public long invalidRecords;
  }

  public static class Summary {
    public String status; // SUCCESS, PARTIAL_SUCCESS, FAILED, NO_DATA
    public String message;
    public List<String> highlights;
    public List<String> concerns;
  }
}
