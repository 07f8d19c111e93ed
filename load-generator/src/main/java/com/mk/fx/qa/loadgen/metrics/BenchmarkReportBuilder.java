package com.mk.fx.qa.loadgen.metrics;

import static com.google.common.base.Preconditions.checkState;

import com.mk.fx.qa.loadgen.dto.BenchmarkReport;
import com.mk.fx.qa.loadgen.executors.closed.ClosedLoadResult;
import java.util.Objects;

/** Turns the statistics of a finished run into a {@link BenchmarkReport}. */
public final class BenchmarkReportBuilder {

  public BenchmarkReport build(ClosedLoadResult result) {
    Objects.requireNonNull(result, "result");
    var stats = result.stats();
    checkState(stats.isStopped(), "Run %s has not been stopped", result.runId());

    var r = new BenchmarkReport();

    // identifiers & timing
    r.runId = result.runId();
    r.target = result.parameters().target().toString();
    r.startTime = stats.startedAt();
    r.endTime = stats.endedAt().orElseThrow();
    r.elapsed = stats.elapsedTime();

    // config
    var cfg = new BenchmarkReport.Config();
    cfg.concurrency = result.parameters().concurrency();
    cfg.repetitions = result.parameters().repetitions();
    cfg.requestsIssued = result.requestsIssued();
    r.config = cfg;

    // counters
    var m = new BenchmarkReport.Metrics();
    m.totalRequests = stats.requestCount();
    m.successCount = stats.successCount();
    m.failureCount = stats.failureCount();
    m.successRate = m.totalRequests == 0 ? 0.0 : (double) m.successCount / m.totalRequests;
    m.transferredBytes = stats.transferredBytes();
    m.transferredKilobytes = stats.transferredBytes() / 1024;
    m.kilobytesPerSecond = stats.throughputKBps();
    m.achievedRps = stats.requestsPerSecond();
    m.failuresByStatus = stats.failuresByStatus();
    r.metrics = m;

    // latency, absent when nothing succeeded
    var lat = new BenchmarkReport.Latency();
    lat.slowest = stats.slowest().orElse(null);
    lat.median = stats.median().orElse(null);
    lat.fastest = stats.fastest().orElse(null);
    lat.average = stats.averageLatency().orElse(null);
    lat.standardDeviation = stats.standardDeviation().orElse(null);
    r.latency = lat;

    return r;
  }
}
