package com.mk.fx.qa.loadgen.service;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * A single load run as requested on the command line.
 *
 * @param target the URL to fetch
 * @param concurrency probes kept in flight
 * @param repetitions total probes to issue
 * @param requestTimeout deadline for one probe
 */
public record LoadRunRequest(URI target, int concurrency, int repetitions, Duration requestTimeout) {

  public LoadRunRequest {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
  }
}
