package com.mk.fx.qa.loadgen.report;

import java.time.Duration;

/**
 * Compact duration rendering for the console report: {@code 1h2m3.5s}, {@code 2.5s}, {@code
 * 12.345ms}, {@code 250µs}, {@code 80ns}, {@code 0s}. Fractions keep up to nanosecond precision
 * without trailing zeros.
 */
public final class DurationFormat {

  private static final long NANOS_PER_MICRO = 1_000L;
  private static final long NANOS_PER_MILLI = 1_000_000L;
  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
  private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;

  private DurationFormat() {
    // Utility class, no instantiation
  }

  public static String format(Duration duration) {
    long nanos = duration.toNanos();
    if (nanos == 0) {
      return "0s";
    }
    var sb = new StringBuilder();
    if (nanos < 0) {
      sb.append('-');
      nanos = -nanos;
    }

    if (nanos < NANOS_PER_MICRO) {
      return sb.append(nanos).append("ns").toString();
    }
    if (nanos < NANOS_PER_MILLI) {
      return sb.append(withFraction(nanos, NANOS_PER_MICRO)).append("µs").toString();
    }
    if (nanos < NANOS_PER_SECOND) {
      return sb.append(withFraction(nanos, NANOS_PER_MILLI)).append("ms").toString();
    }

    long hours = nanos / NANOS_PER_HOUR;
    long minutes = (nanos % NANOS_PER_HOUR) / NANOS_PER_MINUTE;
    long secondNanos = nanos % NANOS_PER_MINUTE;
    if (hours > 0) {
      sb.append(hours).append('h');
    }
    if (hours > 0 || minutes > 0) {
      sb.append(minutes).append('m');
    }
    return sb.append(withFraction(secondNanos, NANOS_PER_SECOND)).append('s').toString();
  }

  private static String withFraction(long value, long unit) {
    long whole = value / unit;
    long fraction = value % unit;
    if (fraction == 0) {
      return Long.toString(whole);
    }
    int digits = Long.toString(unit).length() - 1;
    var padded = new StringBuilder(Long.toString(fraction));
    while (padded.length() < digits) {
      padded.insert(0, '0');
    }
    int end = padded.length();
    while (padded.charAt(end - 1) == '0') {
      end--;
    }
    return whole + "." + padded.substring(0, end);
  }
}
