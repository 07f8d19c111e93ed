package com.mk.fx.qa.loadgen.metrics;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs a progress snapshot at a fixed interval. Driven by the consumer thread after each recorded
 * measurement, so it reads {@link BenchmarkStats} without sharing it with another thread.
 */
@Slf4j
public final class ProgressReporter {

  private final String runId;
  private final int repetitions;
  private final long intervalNanos;
  private final LongSupplier nanoClock;
  private long nextReportAt;
  private int snapshots;

  public ProgressReporter(String runId, int repetitions, Duration interval) {
    this(runId, repetitions, interval, System::nanoTime);
  }

  @VisibleForTesting
  ProgressReporter(String runId, int repetitions, Duration interval, LongSupplier nanoClock) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.repetitions = repetitions;
    this.intervalNanos = Objects.requireNonNull(interval, "interval").toNanos();
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.nextReportAt = nanoClock.getAsLong() + intervalNanos;
  }

  /**
   * Logs a snapshot if the interval has passed since the previous one.
   *
   * @return true if a snapshot was logged
   */
  public boolean maybeReport(BenchmarkStats stats, int requestsIssued) {
    if (intervalNanos <= 0) {
      return false;
    }
    long now = nanoClock.getAsLong();
    if (now - nextReportAt < 0) {
      return false;
    }
    nextReportAt = now + intervalNanos;
    snapshots++;
    log.info(
        "Run {} progress: completed={}/{}, issued={}, successes={}, failures={}, rps={}",
        runId,
        stats.requestCount(),
        repetitions,
        requestsIssued,
        stats.successCount(),
        stats.failureCount(),
        String.format("%.2f", stats.requestsPerSecond()));
    return true;
  }

  public int snapshots() {
    return snapshots;
  }
}
