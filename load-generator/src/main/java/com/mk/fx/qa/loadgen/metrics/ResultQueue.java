package com.mk.fx.qa.loadgen.metrics;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off of {@link Measurement}s from many probe threads to one consumer. Capacity equals
 * the concurrency level, so a producer only blocks if the consumer falls behind by a full round.
 */
public final class ResultQueue {

  private final BlockingQueue<Measurement> queue;
  private final int capacity;

  public ResultQueue(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  public void publish(Measurement measurement) throws InterruptedException {
    queue.put(measurement);
  }

  /** Waits for the next measurement in completion order. */
  public Measurement take() throws InterruptedException {
    return queue.take();
  }

  /** Waits up to the given timeout; returns null if nothing arrived. */
  public Measurement poll(long timeout, TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }
}
