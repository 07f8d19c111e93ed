package com.mk.fx.qa.loadgen.executors.closed;

import java.net.URI;
import java.util.Objects;

/**
 * Parameters for a closed load run.
 *
 * @param target the URL every probe fetches
 * @param concurrency the number of probes kept outstanding
 * @param repetitions the total number of probes to issue over the run
 */
public record ClosedLoadParameters(URI target, int concurrency, int repetitions) {

  public ClosedLoadParameters {
    Objects.requireNonNull(target, "target");
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
    }
    if (repetitions < 1) {
      throw new IllegalArgumentException("repetitions must be >= 1, got " + repetitions);
    }
  }

  /** Number of probes launched before any measurement has been consumed. */
  public int initialProbes() {
    return Math.min(concurrency, repetitions);
  }
}
