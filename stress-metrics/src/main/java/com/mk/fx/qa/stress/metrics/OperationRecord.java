package com.mk.fx.qa.stress.metrics;

import com.mk.fx.qa.stress.model.OperationType;
import com.mk.fx.qa.stress.model.Outcome;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one completed storage operation. Consumed by the recorder as soon as it is created and
 * never retained.
 *
 * @param failureKind classification of a failure, {@code null} for successes
 */
public record OperationRecord(
    OperationType type,
    long sizeBytes,
    Duration duration,
    Outcome outcome,
    String failureKind,
    String workerId,
    Instant timestamp) {}
