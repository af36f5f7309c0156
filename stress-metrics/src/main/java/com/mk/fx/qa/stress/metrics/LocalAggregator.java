package com.mk.fx.qa.stress.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.stress.metrics.transport.SnapshotTransport;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a process's {@link OperationRecorder} into a stream of cumulative {@link WorkerSnapshot}s.
 *
 * <p>A single daemon timer captures the recorder at a fixed cadence, stamps the next sequence
 * number and hands the snapshot to the transport. Operation threads never wait for a tick. On stop
 * one last snapshot, flagged final, is published and the transport is given a bounded grace period
 * to deliver it.
 */
@Slf4j
public class LocalAggregator {

  private final OperationRecorder recorder;
  private final SnapshotTransport transport;
  private final Duration flushInterval;
  private final Clock clock;
  private final ResourceSampler resourceSampler;
  private final ReentrantLock flushLock = new ReentrantLock();

  private ScheduledExecutorService ticker;
  private long sequence;
  private boolean stopped;

  public LocalAggregator(
      OperationRecorder recorder,
      SnapshotTransport transport,
      Duration flushInterval,
      Clock clock) {
    this(recorder, transport, flushInterval, clock, new ResourceSampler());
  }

  public LocalAggregator(
      OperationRecorder recorder,
      SnapshotTransport transport,
      Duration flushInterval,
      Clock clock,
      ResourceSampler resourceSampler) {
    this.resourceSampler = Objects.requireNonNull(resourceSampler, "resourceSampler");
    this.recorder = Objects.requireNonNull(recorder, "recorder");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("Flush interval must be positive");
    }
  }

  public synchronized void start() {
    if (ticker != null) {
      throw new IllegalStateException("Local aggregator already started");
    }
    log.info(
        "Starting local aggregator for worker {} - flush every {}ms",
        recorder.getWorkerId(),
        flushInterval.toMillis());
    ticker =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("metrics-flush-" + recorder.getWorkerId());
              t.setDaemon(true);
              return t;
            });
    long periodMs = flushInterval.toMillis();
    ticker.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Publishes the final snapshot and waits up to {@code grace} for the transport to deliver it.
   * Later calls do nothing.
   *
   * @return true if every published snapshot was delivered or dropped within the grace period
   */
  public boolean stop(Duration grace) {
    synchronized (this) {
      if (ticker != null) {
        ticker.shutdownNow();
        try {
          ticker.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    }
    flushLock.lock();
    try {
      if (stopped) return true;
      publish(true);
      stopped = true;
    } finally {
      flushLock.unlock();
    }
    boolean flushed = transport.flush(grace);
    log.info(
        "Local aggregator for worker {} stopped after {} snapshot(s), final delivery {}",
        recorder.getWorkerId(),
        sequence,
        flushed ? "complete" : "incomplete");
    return flushed;
  }

  /** Captures and publishes a snapshot now, outside the timer. */
  @VisibleForTesting
  public WorkerSnapshot flushNow() {
    flushLock.lock();
    try {
      if (stopped) {
        throw new IllegalStateException("Local aggregator already stopped");
      }
      return publish(false);
    } finally {
      flushLock.unlock();
    }
  }

  public long lastSequence() {
    flushLock.lock();
    try {
      return sequence;
    } finally {
      flushLock.unlock();
    }
  }

  private void tick() {
    flushLock.lock();
    try {
      if (!stopped) publish(false);
    } catch (RuntimeException e) {
      log.error("Periodic flush for worker {} failed", recorder.getWorkerId(), e);
    } finally {
      flushLock.unlock();
    }
  }

  private WorkerSnapshot publish(boolean last) {
    var snapshot =
        new WorkerSnapshot(
            recorder.getWorkerId(),
            ++sequence,
            recorder.getStartedAt(),
            clock.instant(),
            last,
            recorder.getBuckets().asList(),
            recorder.captureTotals(),
            recorder.invalidRecords(),
            transport.droppedSnapshots(),
            sampleResources());
    transport.publish(snapshot);
    log.debug("Published snapshot {}#{} (final={})", snapshot.workerId(), sequence, last);
    return snapshot;
  }

  private ResourceUsage sampleResources() {
    try {
      return resourceSampler.sample();
    } catch (RuntimeException e) {
      log.debug("Resource sampling failed: {}", e.getMessage());
      return null;
    }
  }
}
