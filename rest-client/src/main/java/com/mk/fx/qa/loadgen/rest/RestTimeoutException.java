package com.mk.fx.qa.loadgen.rest;

import java.time.Duration;
import lombok.Getter;

/** Raised when an exchange, body included, did not complete within the request deadline. */
@Getter
public class RestTimeoutException extends RestClientException {

    private final Duration deadline;

    public RestTimeoutException(String message, Duration deadline, Throwable cause) {
        super(message, cause);
        this.deadline = deadline;
    }
}
