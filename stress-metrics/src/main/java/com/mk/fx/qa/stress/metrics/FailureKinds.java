package com.mk.fx.qa.stress.metrics;

import java.util.Locale;

/** Normalises failure kinds reported by drivers into stable upper-case labels. */
public final class FailureKinds {

  public static final String UNKNOWN = "UNKNOWN";
  public static final String OTHER = "OTHER";

  private FailureKinds() {
    // Prevent instantiation
  }

  public static String normalise(String kind) {
    return kind == null || kind.isBlank() ? UNKNOWN : kind.trim().toUpperCase(Locale.ROOT);
  }

  /** Maps an exception to a kind using its root cause. */
  public static String classify(Throwable t) {
    if (t == null) return UNKNOWN;
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "SSLException" -> "SSL_ERROR";
      case "HttpTimeoutException" -> "HTTP_TIMEOUT";
      default -> clsName.isBlank() ? "EXCEPTION" : normalise(clsName);
    };
  }
}
