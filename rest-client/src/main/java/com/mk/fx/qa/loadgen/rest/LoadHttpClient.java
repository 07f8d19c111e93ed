package com.mk.fx.qa.loadgen.rest;

import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP client used to probe a single target URL with GET requests. Every exchange, response body
 * included, is bounded by a request deadline; an exchange that misses it is cancelled. This
 * implementation does not include retry logic. Redirects are followed, except from https to http.
 *
 * <p>Reply sizes are accounted the way the load report expects them: the sum of every header name
 * and value length, plus the number of body bytes read. Header bytes are kept when the body could
 * not be read completely.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

    /** Default request deadline in seconds. */
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Global headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Deadline for a whole exchange, from send until the last body byte. */
    private final Duration requestTimeout;

    /**
     * Constructs a LoadHttpClient with the default request deadline.
     *
     * @param connTimeOutSeconds connection timeout in seconds
     * @param headers global headers to include in all requests
     */
    public LoadHttpClient(int connTimeOutSeconds, Map<String, String> headers) {
        this(
                Duration.ofSeconds(connTimeOutSeconds),
                Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS),
                headers);
    }

    /**
     * Constructs a LoadHttpClient with a specified request deadline.
     *
     * @param connectTimeout connection timeout
     * @param requestTimeout deadline for a whole exchange
     * @param headers global headers to include in all requests
     */
    public LoadHttpClient(Duration connectTimeout, Duration requestTimeout, Map<String, String> headers) {
        Objects.requireNonNull(connectTimeout, "Connection timeout cannot be null");
        Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("Connection timeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();

        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "LoadHttpClient initialised - Connection timeout: {}, Request timeout: {}, Global headers: {}",
                connectTimeout,
                requestTimeout,
                this.headers.keySet());
    }

    /**
     * Fetches the target with a GET request and waits for the complete response.
     *
     * <p>A response whose body fails mid-read is not an error: the returned data carries the status
     * code, the header bytes and {@code bodyReadFailed == true}.
     *
     * @param target absolute http or https URI
     * @return the response data
     * @throws RestTimeoutException if the exchange did not complete within the request deadline
     * @throws RestClientException if no response could be obtained
     */
    public RestResponseData fetch(URI target) {
        Objects.requireNonNull(target, "Target cannot be null");

        var startTime = System.nanoTime();
        var httpRequest = buildHttpRequest(target);
        var received = new AtomicReference<HttpResponse.ResponseInfo>();

        HttpResponse.BodyHandler<byte[]> bodyHandler =
                responseInfo -> {
                    received.set(responseInfo);
                    return HttpResponse.BodySubscribers.ofByteArray();
                };

        log.debug("Executing GET request to {}", target);
        CompletableFuture<HttpResponse<byte[]>> call = httpClient.sendAsync(httpRequest, bodyHandler);

        try {
            var response = call.get(requestTimeout.toNanos(), TimeUnit.NANOSECONDS);
            var result = buildResponseData(
                    response.statusCode(), response.headers(), response.body().length, false, startTime);
            log.debug(
                    "Request completed in {} ms with status {}", result.getResponseTimeMs(), result.getStatusCode());
            return result;

        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                throw new RestTimeoutException(
                        "Request to " + target + " timed out after " + requestTimeout, requestTimeout, cause);
            }
            var responseInfo = received.get();
            if (responseInfo == null) {
                throw new RestClientException(
                        "Error executing request to " + target + ": " + describe(cause), cause);
            }
            log.warn(
                    "Failed to read response body from {} (status {}): {}",
                    target,
                    responseInfo.statusCode(),
                    describe(cause));
            return buildResponseData(responseInfo.statusCode(), responseInfo.headers(), 0, true, startTime);

        } catch (TimeoutException e) {
            call.cancel(true);
            throw new RestTimeoutException(
                    "Request to " + target + " timed out after " + requestTimeout, requestTimeout, e);

        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new RestClientException("Request to " + target + " interrupted", e);
        }
    }

    /**
     * Builds a GET request for the target.
     *
     * @param target the URI to request
     * @return the constructed HttpRequest
     * @throws RestClientException if the target is not a valid http(s) URI
     */
    private HttpRequest buildHttpRequest(URI target) {
        try {
            var requestBuilder = HttpRequest.newBuilder()
                    .uri(target)
                    .timeout(requestTimeout)
                    .GET();

            // global headers
            headers.forEach(requestBuilder::header);

            return requestBuilder.build();

        } catch (IllegalArgumentException e) {
            throw new RestClientException("Error building HTTP request: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a RestResponseData object from the received status and headers.
     *
     * @param statusCode the response status code
     * @param responseHeaders the response headers
     * @param bodyBytes number of body bytes read
     * @param bodyReadFailed whether reading the body failed
     * @param startTime nano time at which the exchange was started
     * @return the constructed RestResponseData
     */
    private RestResponseData buildResponseData(
            int statusCode, HttpHeaders responseHeaders, long bodyBytes, boolean bodyReadFailed, long startTime) {
        var result = new RestResponseData();
        result.setStatusCode(statusCode);
        result.setHeaderBytes(headerBytes(responseHeaders));
        result.setBodyBytes(bodyBytes);
        result.setBodyReadFailed(bodyReadFailed);
        result.setResponseTimeMs((System.nanoTime() - startTime) / 1_000_000);
        return result;
    }

    /**
     * Sums, over every header, the length of its name and of each of its values.
     *
     * @param responseHeaders the headers to measure
     * @return the number of header bytes
     */
    @VisibleForTesting
    static long headerBytes(HttpHeaders responseHeaders) {
        long size = 0;
        for (Map.Entry<String, List<String>> header : responseHeaders.map().entrySet()) {
            size += header.getKey().length();
            for (String value : header.getValue()) {
                size += value.length();
            }
        }
        return size;
    }

    private static String describe(Throwable throwable) {
        var message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getSimpleName();
    }

    @Override
    public void close() {
        // java.net.http.HttpClient has no close on JDK 17; connections are released when idle
        log.debug("LoadHttpClient closed");
    }
}
