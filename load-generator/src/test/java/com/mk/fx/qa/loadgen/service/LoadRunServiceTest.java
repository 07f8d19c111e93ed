package com.mk.fx.qa.loadgen.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.mk.fx.qa.loadgen.cfg.LoadGeneratorCfg;
import com.mk.fx.qa.loadgen.probe.Probe;
import com.mk.fx.qa.loadgen.probe.ProbeResult;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadRunServiceTest {

  private static final URI UNUSED_TARGET = URI.create("http://localhost:1/");

  private final CountDownLatch release = new CountDownLatch(1);
  private HttpServer server;
  private LoadRunService service;

  @BeforeEach
  void setUp() throws Exception {
    var cfg = new LoadGeneratorCfg();
    cfg.setProgressInterval(Duration.ZERO);
    cfg.setConnectionTimeout(Duration.ofSeconds(2));
    service = new LoadRunService(cfg);

    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.setExecutor(Executors.newCachedThreadPool());
    server.createContext(
        "/ok",
        exchange -> {
          byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.createContext(
        "/stall",
        exchange -> {
          exchange.sendResponseHeaders(200, 100);
          OutputStream os = exchange.getResponseBody();
          os.write(new byte[10]);
          os.flush();
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          exchange.close();
        });
    server.start();
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    server.stop(0);
  }

  private static LoadRunRequest request(URI target, int concurrency, int repetitions) {
    return new LoadRunRequest(target, concurrency, repetitions, Duration.ofSeconds(5));
  }

  @Test
  void allFailures_recordEveryRequestWithoutLatencies() throws Exception {
    Probe probe = mock(Probe.class);
    when(probe.fetch(any())).thenReturn(new ProbeResult(503, 12));

    var result = service.execute(request(UNUSED_TARGET, 3, 10), probe);
    var stats = result.stats();

    verify(probe, times(10)).fetch(UNUSED_TARGET);
    assertEquals(10, result.requestsIssued());
    assertEquals(0, stats.successCount());
    assertEquals(10, stats.failureCount());
    assertEquals(120, stats.transferredBytes());
    assertEquals(Map.of(503, 10), stats.failuresByStatus());
    assertTrue(stats.latencies().isEmpty());
    assertTrue(stats.median().isEmpty());
    assertTrue(stats.isStopped());
  }

  @Test
  void mixedStatuses_keepCountsConsistent() throws Exception {
    int[] statuses = {200, 201, 204, 301, 404, 500, 503};
    Probe probe =
        target -> {
          int status = statuses[ThreadLocalRandom.current().nextInt(statuses.length)];
          return new ProbeResult(status, 3);
        };

    var result = service.execute(request(UNUSED_TARGET, 4, 200), probe);
    var stats = result.stats();

    assertEquals(200, stats.requestCount());
    assertEquals(200, result.requestsIssued());
    assertEquals(stats.successCount(), stats.latencies().size());
    assertEquals(
        stats.failureCount(),
        stats.failuresByStatus().values().stream().mapToInt(Integer::intValue).sum());
    assertEquals(600, stats.transferredBytes());
    assertTrue(stats.fastest().orElse(Duration.ZERO).compareTo(stats.slowest().orElse(Duration.ZERO)) <= 0);
  }

  @Test
  void errorThrowingProbe_completesRunWithFailures() {
    Probe probe =
        target -> {
          throw new AssertionError("boom");
        };

    var result =
        assertTimeoutPreemptively(
            Duration.ofSeconds(5), () -> service.execute(request(UNUSED_TARGET, 2, 4), probe));

    assertEquals(4, result.stats().failureCount());
    assertEquals(Map.of(ProbeResult.TRANSPORT_FAILURE_STATUS, 4), result.stats().failuresByStatus());
  }

  @Test
  void concurrencyAboveRepetitions_issuesExactlyRepetitions() throws Exception {
    Probe probe = mock(Probe.class);
    when(probe.fetch(any())).thenReturn(new ProbeResult(200, 1));

    var result = service.execute(request(UNUSED_TARGET, 10, 3), probe);

    verify(probe, times(3)).fetch(any());
    assertEquals(3, result.requestsIssued());
    assertEquals(3, result.stats().successCount());
    assertEquals(3, result.parameters().initialProbes());
  }

  @Test
  void execute_againstLocalServer_countsHeadersAndBody() throws Exception {
    var target = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/ok");

    var result = service.execute(request(target, 2, 20));
    var stats = result.stats();

    assertEquals(20, stats.successCount());
    assertEquals(0, stats.failureCount());
    assertEquals(20, stats.latencies().size());
    // every reply carries the 5 byte body plus some headers
    assertTrue(stats.transferredBytes() > 20 * 5, "bytes: " + stats.transferredBytes());
    assertTrue(stats.averageLatency().isPresent());
  }

  @Test
  void execute_againstUnreachableTarget_recordsTransportFailures() throws Exception {
    var result = service.execute(request(URI.create("http://127.0.0.1:1/"), 2, 4));
    var stats = result.stats();

    assertEquals(4, stats.failureCount());
    assertEquals(Map.of(ProbeResult.TRANSPORT_FAILURE_STATUS, 4), stats.failuresByStatus());
    assertEquals(0, stats.transferredBytes());
    assertTrue(stats.averageLatency().isEmpty());
  }

  @Test
  void execute_stalledBody_recordsDeadlineExpiryAsTransportFailure() throws Exception {
    var target = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/stall");

    var result =
        service.execute(new LoadRunRequest(target, 1, 1, Duration.ofMillis(300)));
    var stats = result.stats();

    assertEquals(Map.of(ProbeResult.TRANSPORT_FAILURE_STATUS, 1), stats.failuresByStatus());
    assertEquals(0, stats.transferredBytes());
  }

  @Test
  void execute_rejectsNullArguments() {
    assertThrows(NullPointerException.class, () -> service.execute(null));
    assertThrows(
        NullPointerException.class, () -> service.execute(request(UNUSED_TARGET, 1, 1), null));
  }
}
