package com.mk.fx.qa.loadgen.report;

import com.mk.fx.qa.loadgen.dto.BenchmarkReport;
import java.time.Duration;
import java.util.List;

/** Renders a {@link BenchmarkReport} as the line-per-metric console summary. */
public final class ConsoleReportFormatter {

  static final String NOT_AVAILABLE = "n/a";

  private ConsoleReportFormatter() {
    throw new UnsupportedOperationException("ConsoleReportFormatter cannot be instantiated");
  }

  public static List<String> format(BenchmarkReport report) {
    var metrics = report.metrics;
    var latency = report.latency;
    return List.of(
        "Successful requests: " + metrics.successCount,
        "Failed requests: " + metrics.failureCount,
        "Transferred kilobytes: " + metrics.transferredKilobytes,
        "Kilobytes per second: " + metrics.kilobytesPerSecond,
        "Elapsed wall-clock time: " + DurationFormat.format(report.elapsed),
        "Slowest request: " + orNotAvailable(latency.slowest),
        "Median request: " + orNotAvailable(latency.median),
        "Fastest request: " + orNotAvailable(latency.fastest),
        "Average request: " + orNotAvailable(latency.average),
        "Standard deviation: " + orNotAvailable(latency.standardDeviation));
  }

  private static String orNotAvailable(Duration duration) {
    return duration == null ? NOT_AVAILABLE : DurationFormat.format(duration);
  }
}
