package com.mk.fx.qa.loadgen.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ResultQueueTest {

  private static Measurement measurement(int status) {
    return new Measurement(status, 0, Duration.ofMillis(1));
  }

  @Test
  void deliversInPublicationOrder() throws Exception {
    var queue = new ResultQueue(3);
    queue.publish(measurement(200));
    queue.publish(measurement(404));

    assertEquals(2, queue.size());
    assertEquals(200, queue.take().statusCode());
    assertEquals(404, queue.take().statusCode());
    assertNull(queue.poll(10, TimeUnit.MILLISECONDS));
  }

  @Test
  void publisherBlocksWhenFull_untilConsumerTakes() throws Exception {
    var queue = new ResultQueue(1);
    queue.publish(measurement(200));
    var published = new CountDownLatch(1);

    Thread producer =
        new Thread(
            () -> {
              try {
                queue.publish(measurement(201));
                published.countDown();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    producer.start();

    assertFalse(published.await(100, TimeUnit.MILLISECONDS));
    assertEquals(200, queue.take().statusCode());
    assertTrue(published.await(5, TimeUnit.SECONDS));
    assertEquals(201, queue.take().statusCode());
    producer.join();
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new ResultQueue(0));
    assertEquals(4, new ResultQueue(4).capacity());
  }
}
