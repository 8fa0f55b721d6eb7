package com.purchasingpower.codegraph.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A traversal or resolution query did not finish within the configured bound.
 * Callers may retry with a smaller depth or limit.
 */
@Getter
public class GraphQueryTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public GraphQueryTimeoutException(String operation, Duration timeout) {
        super(operation + " did not complete within " + timeout.toMillis() + "ms");
        this.operation = operation;
        this.timeout = timeout;
    }
}
