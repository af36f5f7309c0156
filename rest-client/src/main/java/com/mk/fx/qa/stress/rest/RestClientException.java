package com.mk.fx.qa.stress.rest;

/** Raised when a request cannot be built, sent, or times out. */
public class RestClientException extends RuntimeException {

  public RestClientException(String message) {
    super(message);
  }

  public RestClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
