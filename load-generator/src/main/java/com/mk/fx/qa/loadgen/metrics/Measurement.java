package com.mk.fx.qa.loadgen.metrics;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable result of one probe invocation, handed from a probe thread to the consumer.
 *
 * @param statusCode HTTP status or the synthetic transport failure status
 * @param replySize bytes attributable to the response
 * @param duration time from issuance to completion of the probe call
 */
public record Measurement(int statusCode, long replySize, Duration duration) {

  public Measurement {
    Objects.requireNonNull(duration, "duration");
    if (replySize < 0) {
      throw new IllegalArgumentException("replySize must be >= 0");
    }
    if (duration.isNegative()) {
      throw new IllegalArgumentException("duration must not be negative");
    }
  }

  /** Success means a status in the 2xx range; everything else counts as a failure. */
  public boolean isSuccess() {
    return statusCode >= 200 && statusCode <= 299;
  }
}
