package com.mk.fx.qa.loadgen.probe;

/**
 * Outcome of a single {@link Probe#fetch} call.
 *
 * @param statusCode HTTP status, or {@link #TRANSPORT_FAILURE_STATUS} when no response was obtained
 * @param size header bytes plus the body bytes that could be read
 */
public record ProbeResult(int statusCode, long size) {

  /** Status reported when the request produced no response at all. */
  public static final int TRANSPORT_FAILURE_STATUS = 500;

  private static final ProbeResult TRANSPORT_FAILURE = new ProbeResult(TRANSPORT_FAILURE_STATUS, 0);

  public ProbeResult {
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0");
    }
  }

  public static ProbeResult transportFailure() {
    return TRANSPORT_FAILURE;
  }
}
