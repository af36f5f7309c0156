package com.mk.fx.qa.stress.model;

import java.util.Arrays;
import java.util.Locale;

/** Storage operation kinds tracked by the recorder. */
public enum OperationType {
  UPLOAD,
  DOWNLOAD,
  DELETE,
  LIST,
  HEAD,
  OTHER;

  /** Lower-case name used as exposition label and console row name. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static OperationType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported operation type: " + value));
  }
}
