package com.mk.fx.qa.stress.metrics;

import com.mk.fx.qa.stress.model.OperationType;
import com.mk.fx.qa.stress.model.Outcome;
import java.time.Duration;

/**
 * Entry point for the workload layer, called once per completed operation. Implementations are
 * safe for any number of concurrent callers and never perform I/O or block on delivery. Invalid
 * input is counted and dropped rather than thrown.
 */
public interface Recorder {

  void record(OperationRecord record);

  void record(
      OperationType type, long sizeBytes, Duration duration, Outcome outcome, String failureKind);

  default void recordSuccess(OperationType type, long sizeBytes, Duration duration) {
    record(type, sizeBytes, duration, Outcome.SUCCESS, null);
  }

  /** Records a failed operation, classifying {@code error} by its root cause. */
  default void recordFailure(
      OperationType type, long sizeBytes, Duration duration, Throwable error) {
    record(type, sizeBytes, duration, Outcome.FAILURE, FailureKinds.classify(error));
  }
}
