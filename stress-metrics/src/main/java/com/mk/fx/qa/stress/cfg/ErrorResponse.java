package com.mk.fx.qa.stress.cfg;

import java.time.Instant;

/**
 * Error body returned by the HTTP API.
 *
 * @param error short error title
 * @param details what was wrong with the request
 * @param timestamp when the error was produced
 */
public record ErrorResponse(String error, String details, Instant timestamp) {

  public ErrorResponse(String error, String details) {
    this(error, details, Instant.now());
  }
}
