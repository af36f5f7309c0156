package com.mk.fx.qa.stress.metrics.transport;

import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import com.mk.fx.qa.stress.rest.JsonHttpClient;
import com.mk.fx.qa.stress.rest.RestClientException;
import com.mk.fx.qa.stress.rest.RestResponseData;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;

/**
 * Posts worker snapshots to a remote coordinator from a dedicated sender thread.
 *
 * <p>{@link #publish} only enqueues into a small drop-oldest buffer, so a slow or unreachable
 * coordinator never stalls recording. Evicted snapshots are superseded by newer cumulative ones and
 * are counted as dropped. Failed posts are not retried.
 */
@Slf4j
public class HttpSnapshotTransport implements SnapshotTransport {

  public static final String SNAPSHOTS_PATH = "/api/snapshots";

  private static final Duration POLL_TIMEOUT = Duration.ofMillis(200);
  private static final long FLUSH_POLL_MS = 10;

  private final JsonHttpClient client;
  private final DropOldestQueue<WorkerSnapshot> queue;
  private final LongAdder dropped = new LongAdder();
  private final LongAdder delivered = new LongAdder();

  /** Queued plus in-flight snapshots. */
  private final AtomicLong pending = new AtomicLong();

  private final AtomicBoolean running = new AtomicBoolean(true);
  private final Thread sender;

  HttpSnapshotTransport(JsonHttpClient client, int capacity) {
    this.client = Objects.requireNonNull(client, "client");
    this.queue = new DropOldestQueue<>(capacity);
    this.sender = new Thread(this::sendLoop, "snapshot-sender");
    this.sender.setDaemon(true);
  }

  /** Creates the transport and starts its sender thread. */
  public static HttpSnapshotTransport start(JsonHttpClient client, int capacity) {
    var transport = new HttpSnapshotTransport(client, capacity);
    transport.sender.start();
    log.info(
        "Snapshot transport started - target {}{}, buffer capacity {}",
        client.getBaseUrl(),
        SNAPSHOTS_PATH,
        capacity);
    return transport;
  }

  @Override
  public void publish(WorkerSnapshot snapshot) {
    if (!running.get()) {
      dropped.increment();
      log.debug(
          "Transport closed, dropping snapshot {}#{}", snapshot.workerId(), snapshot.sequence());
      return;
    }
    pending.incrementAndGet();
    queue
        .offer(snapshot)
        .ifPresent(
            evicted -> {
              pending.decrementAndGet();
              dropped.increment();
              log.debug(
                  "Send buffer full, superseding snapshot {}#{}",
                  evicted.workerId(),
                  evicted.sequence());
            });
  }

  @Override
  public long droppedSnapshots() {
    return dropped.sum();
  }

  public long deliveredSnapshots() {
    return delivered.sum();
  }

  @Override
  public boolean flush(Duration grace) {
    long deadline = System.nanoTime() + grace.toNanos();
    while (pending.get() > 0) {
      if (System.nanoTime() >= deadline) {
        log.warn("{} snapshot(s) still undelivered after {}ms", pending.get(), grace.toMillis());
        return false;
      }
      try {
        Thread.sleep(FLUSH_POLL_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return pending.get() == 0;
      }
    }
    return true;
  }

  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) return;
    sender.interrupt();
    try {
      sender.join(POLL_TIMEOUT.toMillis() * 5);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    long abandoned = pending.getAndSet(0);
    if (abandoned > 0) {
      dropped.add(abandoned);
      log.warn("Closed snapshot transport with {} undelivered snapshot(s)", abandoned);
    }
    client.close();
  }

  private void sendLoop() {
    while (running.get()) {
      WorkerSnapshot snapshot;
      try {
        snapshot = queue.poll(POLL_TIMEOUT);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (snapshot == null) continue;
      try {
        send(snapshot);
      } finally {
        // close() may already have zeroed the count
        pending.updateAndGet(p -> Math.max(0, p - 1));
      }
    }
  }

  void send(WorkerSnapshot snapshot) {
    try {
      RestResponseData response = client.postJson(SNAPSHOTS_PATH, snapshot);
      if (response.isSuccessful()) {
        delivered.increment();
        log.debug(
            "Delivered snapshot {}#{} ({})",
            snapshot.workerId(),
            snapshot.sequence(),
            response.getStatusCode());
      } else {
        dropped.increment();
        log.warn(
            "Coordinator refused snapshot {}#{}: HTTP {} {}",
            snapshot.workerId(),
            snapshot.sequence(),
            response.getStatusCode(),
            response.getBody());
      }
    } catch (RestClientException e) {
      dropped.increment();
      log.warn(
          "Failed to deliver snapshot {}#{}: {}",
          snapshot.workerId(),
          snapshot.sequence(),
          e.getMessage());
    }
  }
}
