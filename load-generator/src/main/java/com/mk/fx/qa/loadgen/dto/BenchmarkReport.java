package com.mk.fx.qa.loadgen.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Final report of a benchmark run, rendered on the console or serialised as JSON. Latency fields
 * are null when the run had no successful request.
 */
public class BenchmarkReport {

  public String runId;
  public String target;
  public Instant startTime;
  public Instant endTime;
  public Duration elapsed;

  public Config config;
  public Metrics metrics;
  public Latency latency;

  public static class Config {
    public int concurrency;
    public int repetitions;
    public int requestsIssued;
  }

  public static class Metrics {
    public long totalRequests;
    public long successCount;
    public long failureCount;
    public double successRate;
    public long transferredBytes;
    public long transferredKilobytes;
    public long kilobytesPerSecond;
    public double achievedRps;
    public Map<Integer, Integer> failuresByStatus;
  }

  public static class Latency {
    public Duration slowest;
    public Duration median;
    public Duration fastest;
    public Duration average;
    public Duration standardDeviation;
  }
}
