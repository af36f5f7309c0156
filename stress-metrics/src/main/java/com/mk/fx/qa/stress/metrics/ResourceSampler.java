package com.mk.fx.qa.stress.metrics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;
import java.util.concurrent.atomic.AtomicLong;

/** Reads heap, CPU and thread gauges of the running JVM. */
public class ResourceSampler {

  private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
  private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
  private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
  private final AtomicLong heapPeak = new AtomicLong();

  public ResourceUsage sample() {
    long heapUsed = memory.getHeapMemoryUsage().getUsed();
    long peak = heapPeak.accumulateAndGet(heapUsed, Math::max);
    return new ResourceUsage(
        heapUsed, peak, processCpuLoad(), threads.getThreadCount(), threads.getPeakThreadCount());
  }

  private double processCpuLoad() {
    double load = -1;
    if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
      load = sunOs.getProcessCpuLoad();
    }
    // Negative when the platform cannot report it
    return load < 0 ? 0.0 : load;
  }
}
