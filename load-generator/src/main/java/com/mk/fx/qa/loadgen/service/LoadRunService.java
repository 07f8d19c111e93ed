package com.mk.fx.qa.loadgen.service;

import static com.mk.fx.qa.loadgen.utils.LoadUtils.toDuration;

import com.mk.fx.qa.loadgen.cfg.LoadGeneratorCfg;
import com.mk.fx.qa.loadgen.executors.closed.ClosedLoadDispatcher;
import com.mk.fx.qa.loadgen.executors.closed.ClosedLoadParameters;
import com.mk.fx.qa.loadgen.executors.closed.ClosedLoadResult;
import com.mk.fx.qa.loadgen.metrics.BenchmarkStats;
import com.mk.fx.qa.loadgen.metrics.ProgressReporter;
import com.mk.fx.qa.loadgen.probe.HttpProbe;
import com.mk.fx.qa.loadgen.probe.Probe;
import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one benchmark: starts the {@link ClosedLoadDispatcher}, drains its result queue into a
 * {@link BenchmarkStats} on the calling thread, and asks the dispatcher for a replacement probe
 * after each drained measurement until the repetition budget has been recorded.
 */
@Slf4j
@Service
public class LoadRunService {

  private final LoadGeneratorCfg cfg;

  public LoadRunService(LoadGeneratorCfg cfg) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
  }

  /** Runs the request against the real target over HTTP. */
  public ClosedLoadResult execute(LoadRunRequest request) throws InterruptedException {
    Objects.requireNonNull(request, "Load run request must not be null");
    try (HttpProbe probe = buildProbe(request)) {
      return execute(request, probe);
    }
  }

  /**
   * Runs the request with the given probe. The calling thread becomes the single consumer and owner
   * of the run statistics.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting for results
   */
  public ClosedLoadResult execute(LoadRunRequest request, Probe probe) throws InterruptedException {
    Objects.requireNonNull(request, "Load run request must not be null");
    Objects.requireNonNull(probe, "probe");

    var runId = UUID.randomUUID().toString().substring(0, 8);
    var parameters =
        new ClosedLoadParameters(request.target(), request.concurrency(), request.repetitions());
    var stats = new BenchmarkStats(parameters.repetitions());
    var progress =
        new ProgressReporter(
            runId, parameters.repetitions(), toDuration(cfg.getProgressInterval()));

    log.info(
        "Run {} started: target={}, concurrency={}, repetitions={}, requestTimeout={}",
        runId,
        parameters.target(),
        parameters.concurrency(),
        parameters.repetitions(),
        request.requestTimeout());

    int requestsIssued;
    try (var dispatcher = new ClosedLoadDispatcher(runId, parameters, probe)) {
      dispatcher.start();
      while (stats.requestCount() < parameters.repetitions()) {
        var measurement = dispatcher.results().take();
        stats.recordMeasurement(measurement);
        progress.maybeReport(stats, dispatcher.requestsIssued());
        dispatcher.onMeasurementConsumed();
      }
      stats.stop();
      requestsIssued = dispatcher.requestsIssued();
    }

    log.info(
        "Run {} summary: requests={}, successes={}, failures={}, transferredBytes={}, elapsed={}, rps={}",
        runId,
        stats.requestCount(),
        stats.successCount(),
        stats.failureCount(),
        stats.transferredBytes(),
        stats.elapsedTime(),
        String.format("%.2f", stats.requestsPerSecond()));
    if (stats.successCount() == 0) {
      log.warn("Run {} had no successful request; latency statistics are not available", runId);
    }
    if (!stats.failuresByStatus().isEmpty()) {
      log.info("Run {} failures by status: {}", runId, stats.failuresByStatus());
    }

    return new ClosedLoadResult(runId, parameters, stats, requestsIssued);
  }

  private HttpProbe buildProbe(LoadRunRequest request) {
    var client =
        new LoadHttpClient(cfg.getConnectionTimeout(), request.requestTimeout(), cfg.getHeaders());
    return new HttpProbe(client);
  }
}
