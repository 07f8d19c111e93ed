package com.mk.fx.qa.loadgen.probe;

import java.net.URI;

/**
 * Performs one request against a target and reports what came back. Implementations must absorb
 * every failure into the returned {@link ProbeResult}; callers treat a thrown exception as a
 * contract violation.
 */
@FunctionalInterface
public interface Probe {

  /**
   * Fetches the target once.
   *
   * @param target the URL to fetch
   * @return status code and reply size, or {@link ProbeResult#transportFailure()} when no response
   *     could be obtained
   */
  ProbeResult fetch(URI target);
}
