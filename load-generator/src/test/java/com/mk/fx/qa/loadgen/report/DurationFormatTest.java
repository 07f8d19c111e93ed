package com.mk.fx.qa.loadgen.report;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationFormatTest {

  @Test
  void picksTheLargestUnitBelowOneSecond() {
    assertEquals("0s", DurationFormat.format(Duration.ZERO));
    assertEquals("80ns", DurationFormat.format(Duration.ofNanos(80)));
    assertEquals("1.5µs", DurationFormat.format(Duration.ofNanos(1_500)));
    assertEquals("250µs", DurationFormat.format(Duration.ofNanos(250_000)));
    assertEquals("12.345ms", DurationFormat.format(Duration.ofNanos(12_345_000)));
    assertEquals("11.180339ms", DurationFormat.format(Duration.ofNanos(11_180_339)));
  }

  @Test
  void composesHoursMinutesAndSeconds() {
    assertEquals("2.5s", DurationFormat.format(Duration.ofMillis(2_500)));
    assertEquals("1m30s", DurationFormat.format(Duration.ofSeconds(90)));
    assertEquals("1h2m3.5s", DurationFormat.format(Duration.ofMillis(3_723_500)));
    assertEquals("1h0m0s", DurationFormat.format(Duration.ofHours(1)));
  }

  @Test
  void keepsTheSignOfNegativeDurations() {
    assertEquals("-3ms", DurationFormat.format(Duration.ofMillis(-3)));
  }
}
