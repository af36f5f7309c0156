package com.mk.fx.qa.stress.model;

import java.util.Locale;

public enum Outcome {
  SUCCESS,
  FAILURE;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
