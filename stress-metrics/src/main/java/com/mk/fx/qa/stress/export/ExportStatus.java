package com.mk.fx.qa.stress.export;

import java.time.Instant;

/** Outcome of the structured export so far; failures never stop the run. */
public record ExportStatus(
    long written, long failures, Instant lastWrittenAt, String lastError) {

  public static ExportStatus none() {
    return new ExportStatus(0, 0, null, null);
  }
}
