package com.mk.fx.qa.loadgen.executors.closed;

import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.loadgen.metrics.Measurement;
import com.mk.fx.qa.loadgen.metrics.ResultQueue;
import com.mk.fx.qa.loadgen.probe.Probe;
import com.mk.fx.qa.loadgen.probe.ProbeResult;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues probes under a "closed" load model: a fixed number of probes stay outstanding, and a new
 * one is issued only after the consumer has taken a finished measurement off the {@link
 * ResultQueue}. A slow target therefore throttles issuance instead of piling up requests.
 *
 * <p>Threading: probes run on a fixed pool sized to the concurrency level and publish their
 * measurements to the queue. {@link #start()} and {@link #onMeasurementConsumed()} must be called
 * from the single consumer thread; the issued counter is not shared with probe threads.
 */
@Slf4j
public final class ClosedLoadDispatcher implements AutoCloseable {

  private static final long SHUTDOWN_WAIT_SECONDS = 5L;

  private final String runId;
  private final ClosedLoadParameters parameters;
  private final Probe probe;
  private final ResultQueue results;
  private final ExecutorService executor;
  private final AtomicInteger inFlight = new AtomicInteger();

  private int requestsIssued;
  private boolean started;

  public ClosedLoadDispatcher(String runId, ClosedLoadParameters parameters, Probe probe) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    this.probe = Objects.requireNonNull(probe, "probe");
    this.results = new ResultQueue(parameters.concurrency());

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("closed-load-" + runId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    this.executor = newFixedThreadPool(parameters.concurrency(), threadFactory);
  }

  /** Launches the initial {@code min(concurrency, repetitions)} probes. */
  public void start() {
    checkState(!started, "Run %s already started", runId);
    started = true;
    log.info(
        "Run {} dispatching {} initial probes against {} (concurrency={}, repetitions={})",
        runId,
        parameters.initialProbes(),
        parameters.target(),
        parameters.concurrency(),
        parameters.repetitions());
    for (int i = 0; i < parameters.initialProbes(); i++) {
      issue();
    }
  }

  /**
   * Called once per measurement the consumer has drained. Issues exactly one replacement probe while
   * the repetition budget is not exhausted.
   *
   * @return true if a replacement probe was issued
   */
  public boolean onMeasurementConsumed() {
    checkState(started, "Run %s not started", runId);
    if (requestsIssued < parameters.repetitions()) {
      issue();
      return true;
    }
    return false;
  }

  public ResultQueue results() {
    return results;
  }

  public int requestsIssued() {
    return requestsIssued;
  }

  public boolean budgetExhausted() {
    return requestsIssued >= parameters.repetitions();
  }

  @VisibleForTesting
  int inFlight() {
    return inFlight.get();
  }

  private void issue() {
    requestsIssued++;
    inFlight.incrementAndGet();
    log.debug("Run {} issuing probe {}/{}", runId, requestsIssued, parameters.repetitions());
    executor.execute(this::probeOnce);
  }

  /** Runs one probe on a pool thread and hands its measurement to the consumer. */
  private void probeOnce() {
    long startNanos = System.nanoTime();
    ProbeResult result;
    try {
      result = probe.fetch(parameters.target());
      if (result == null) {
        log.error("Run {} probe returned no result; recording a transport failure", runId);
        result = ProbeResult.transportFailure();
      }
    } catch (Throwable t) {
      // an Error must still produce a measurement, or the consumer waits forever
      log.error("Run {} probe failed unexpectedly: {}", runId, t.toString(), t);
      result = ProbeResult.transportFailure();
    }
    var measurement =
        new Measurement(
            result.statusCode(), result.size(), Duration.ofNanos(System.nanoTime() - startNanos));
    inFlight.decrementAndGet();

    try {
      results.publish(measurement);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug("Run {} dropped a measurement after interruption", runId);
    }
  }

  /** Stops the probe pool; outstanding probes are interrupted. */
  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn(
            "Run {} probe threads still running {}s after shutdown", runId, SHUTDOWN_WAIT_SECONDS);
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
