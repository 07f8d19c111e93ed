package com.mk.fx.qa.loadgen.executors.closed;

import com.mk.fx.qa.loadgen.metrics.BenchmarkStats;

/**
 * Represents a finished closed load run.
 *
 * @param runId identifier used in thread names and logs
 * @param parameters the parameters the run was executed with
 * @param stats the stopped statistics of the run
 * @param requestsIssued the number of probes the dispatcher issued
 */
public record ClosedLoadResult(
    String runId, ClosedLoadParameters parameters, BenchmarkStats stats, int requestsIssued) {}
