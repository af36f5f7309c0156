package com.mk.fx.qa.stress.rest;

import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  private String body;
  private long responseTimeMs;

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
