package com.mk.fx.qa.loadgen.probe;

import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import com.mk.fx.qa.loadgen.rest.RestClientException;
import com.mk.fx.qa.loadgen.rest.RestTimeoutException;
import java.net.URI;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Probe} backed by {@link LoadHttpClient}. Transport failures and deadline expiries become
 * {@link ProbeResult#transportFailure()}; a body that fails mid-read keeps its status and header
 * bytes.
 */
@Slf4j
public class HttpProbe implements Probe, AutoCloseable {

  private final LoadHttpClient client;

  public HttpProbe(LoadHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public ProbeResult fetch(URI target) {
    try {
      var response = client.fetch(target);
      return new ProbeResult(response.getStatusCode(), response.totalBytes());
    } catch (RestTimeoutException e) {
      log.warn("Timed out fetching {} after {}", target, e.getDeadline());
      return ProbeResult.transportFailure();
    } catch (RestClientException e) {
      log.warn("Failed to fetch {}: {}", target, e.getMessage());
      log.debug("Fetch failure detail", e);
      return ProbeResult.transportFailure();
    }
  }

  @Override
  public void close() {
    client.close();
  }
}
