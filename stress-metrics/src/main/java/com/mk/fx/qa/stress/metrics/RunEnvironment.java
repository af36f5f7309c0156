package com.mk.fx.qa.stress.metrics;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** Host and user details stamped into run reports and default worker ids. */
public final class RunEnvironment {

  private RunEnvironment() {
    // Prevent instantiation
  }

  /** Host name from the environment, falling back to name resolution, else {@code "unknown"}. */
  public static String host() {
    String env = firstNonBlank(System.getenv("HOSTNAME"), System.getenv("COMPUTERNAME"), null);
    if (env != null) return env;

    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }

  public static String triggeredBy() {
    return firstNonBlank(System.getenv("TRIGGERED_BY"), System.getProperty("user.name"), "unknown");
  }

  /** {@code <host>-<pid>}, unique per process on a host. */
  public static String defaultWorkerId() {
    return host() + "-" + ProcessHandle.current().pid();
  }

  private static String firstNonBlank(String a, String b, String def) {
    if (a != null && !a.isBlank()) return a;
    if (b != null && !b.isBlank()) return b;
    return def;
  }
}
