package com.mk.fx.qa.stress.aggregate;

import com.mk.fx.qa.stress.metrics.ResourceUsage;
import com.mk.fx.qa.stress.model.LivenessStatus;
import java.time.Instant;

/** What the coordinator knows about one worker, as exported. */
public record WorkerState(
    String workerId,
    long lastSequence,
    Instant startedAt,
    Instant lastSeen,
    LivenessStatus status,
    long operations,
    long droppedSnapshots,
    long invalidRecords,
    ResourceUsage resources) {}
