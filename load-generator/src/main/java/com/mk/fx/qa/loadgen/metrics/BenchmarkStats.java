package com.mk.fx.qa.loadgen.metrics;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.LongSupplier;

/**
 * Running totals and latency statistics of one benchmark run.
 *
 * <p>Ownership: an instance belongs to the thread that created it. Only that thread may record
 * measurements or stop the run; any other thread gets an {@link IllegalStateException}. Probe
 * threads never touch it, they hand measurements over through a {@link ResultQueue}.
 *
 * <p>Latency statistics cover successful requests only and are empty when there were none.
 * Derived values are read-only and can be requested any number of times.
 */
public class BenchmarkStats {

  private final Thread owner;
  private final LongSupplier nanoClock;
  private final Instant startedAt;
  private final long startedNanos;

  private final List<Duration> latencies;
  private final Map<Integer, Integer> failuresByStatus = new TreeMap<>();
  private int successCount;
  private int failureCount;
  private long transferredBytes;

  private Instant endedAt;
  private long endedNanos;

  public BenchmarkStats(int expectedRequests) {
    this(expectedRequests, System::nanoTime);
  }

  @VisibleForTesting
  BenchmarkStats(int expectedRequests, LongSupplier nanoClock) {
    this.owner = Thread.currentThread();
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.latencies = new ArrayList<>(Math.max(0, expectedRequests));
    this.startedAt = Instant.now();
    this.startedNanos = nanoClock.getAsLong();
  }

  /** Classifies one measurement and adds it to the running totals. */
  public void recordMeasurement(Measurement measurement) {
    Objects.requireNonNull(measurement, "measurement");
    checkOwner();
    checkState(!isStopped(), "Run already stopped");

    if (measurement.isSuccess()) {
      successCount++;
      latencies.add(measurement.duration());
    } else {
      failureCount++;
      failuresByStatus.merge(measurement.statusCode(), 1, Integer::sum);
    }
    transferredBytes += measurement.replySize();
  }

  /** Marks the end of the run. May be called once. */
  public void stop() {
    checkOwner();
    checkState(!isStopped(), "Run already stopped");
    endedNanos = nanoClock.getAsLong();
    endedAt = Instant.now();
  }

  public boolean isStopped() {
    return endedAt != null;
  }

  public int successCount() {
    return successCount;
  }

  public int failureCount() {
    return failureCount;
  }

  public int requestCount() {
    return successCount + failureCount;
  }

  public long transferredBytes() {
    return transferredBytes;
  }

  /** Latencies of successful requests in arrival order. */
  public List<Duration> latencies() {
    return Collections.unmodifiableList(new ArrayList<>(latencies));
  }

  /** Failure counts keyed by status code, ascending. */
  public Map<Integer, Integer> failuresByStatus() {
    return Collections.unmodifiableMap(new TreeMap<>(failuresByStatus));
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Optional<Instant> endedAt() {
    return Optional.ofNullable(endedAt);
  }

  public Duration elapsedTime() {
    checkState(isStopped(), "Run not stopped yet");
    return Duration.ofNanos(endedNanos - startedNanos);
  }

  public Duration totalLatency() {
    long sum = 0;
    for (Duration latency : latencies) {
      sum += latency.toNanos();
    }
    return Duration.ofNanos(sum);
  }

  /** Mean latency, floored to whole nanoseconds. */
  public Optional<Duration> averageLatency() {
    if (latencies.isEmpty()) return Optional.empty();
    return Optional.of(Duration.ofNanos(averageNanos()));
  }

  public Optional<Duration> slowest() {
    if (latencies.isEmpty()) return Optional.empty();
    Duration max = latencies.get(0);
    for (Duration latency : latencies) {
      if (max.compareTo(latency) < 0) {
        max = latency;
      }
    }
    return Optional.of(max);
  }

  public Optional<Duration> fastest() {
    if (latencies.isEmpty()) return Optional.empty();
    Duration min = latencies.get(0);
    for (Duration latency : latencies) {
      if (min.compareTo(latency) > 0) {
        min = latency;
      }
    }
    return Optional.of(min);
  }

  /**
   * Element at index {@code n / 2} of the sorted latencies. For an even count this is the upper of
   * the two middle values, not their average.
   */
  public Optional<Duration> median() {
    if (latencies.isEmpty()) return Optional.empty();
    List<Duration> sorted = new ArrayList<>(latencies);
    Collections.sort(sorted);
    return Optional.of(sorted.get(sorted.size() / 2));
  }

  /**
   * Population standard deviation around the floored mean from {@link #averageLatency()}, floored
   * to whole nanoseconds.
   */
  public Optional<Duration> standardDeviation() {
    if (latencies.isEmpty()) return Optional.empty();
    long mean = averageNanos();
    double sumSquaredDelta = 0.0;
    for (Duration latency : latencies) {
      double delta = (double) (mean - latency.toNanos());
      sumSquaredDelta += delta * delta;
    }
    double variance = sumSquaredDelta / latencies.size();
    return Optional.of(Duration.ofNanos((long) Math.floor(Math.sqrt(variance))));
  }

  /** Transferred kilobytes per elapsed second, floored; 0 when no time has elapsed. */
  public long throughputKBps() {
    double elapsedSeconds = elapsedTime().toNanos() / 1_000_000_000.0;
    if (elapsedSeconds <= 0.0) {
      return 0;
    }
    return (long) Math.floor(transferredBytes / 1024.0 / elapsedSeconds);
  }

  /** Completed requests per second over the elapsed time so far. */
  public double requestsPerSecond() {
    long endNanos = isStopped() ? endedNanos : nanoClock.getAsLong();
    double elapsedSeconds = Math.max(0.001, (endNanos - startedNanos) / 1_000_000_000.0);
    return requestCount() / elapsedSeconds;
  }

  private long averageNanos() {
    return Math.floorDiv(totalLatency().toNanos(), (long) latencies.size());
  }

  private void checkOwner() {
    Thread current = Thread.currentThread();
    checkState(
        current == owner,
        "Benchmark statistics are owned by thread %s and cannot be mutated from %s",
        owner.getName(),
        current.getName());
  }
}
