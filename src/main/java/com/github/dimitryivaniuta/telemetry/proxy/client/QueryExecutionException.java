package com.github.dimitryivaniuta.telemetry.proxy.client;

/**
 * Transport or query failure reported by the backing engine.
 */
public class QueryExecutionException extends Exception {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
