package com.mk.fx.qa.loadgen.rest;

/**
 * Raised by {@link LoadHttpClient} when an exchange could not produce a response at all
 * (connection refused, unknown host, invalid target, interruption).
 */
public class RestClientException extends RuntimeException {

    public RestClientException(String message) {
        super(message);
    }

    public RestClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
