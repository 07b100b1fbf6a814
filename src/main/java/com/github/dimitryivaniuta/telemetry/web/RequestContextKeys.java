package com.github.dimitryivaniuta.telemetry.web;

/**
 * Header and MDC names shared by the web tier and the log pattern.
 */
public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    /** Accepted when the caller sends no correlation id, e.g. from a load balancer. */
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String RETRY_AFTER_HEADER = "Retry-After";
}
