package com.github.dimitryivaniuta.telemetry.proxy.client;

/**
 * What {@link QueryClientProvider} does after a failed attempt to build the engine handle.
 */
public enum ClientInitFailurePolicy {

    /**
     * Attempt construction again on the next call.
     */
    RETRY_EVERY_CALL,

    /**
     * Report the client as absent without attempting construction until the configured
     * backoff has elapsed since the last failure.
     */
    BACKOFF
}
