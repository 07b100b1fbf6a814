package com.github.dimitryivaniuta.telemetry.proxy.ratelimit;

import lombok.Getter;

/**
 * Raised when the outbound query limiter denies admission. Callers should back off and retry.
 */
@Getter
public class QueryRateLimitedException extends RuntimeException {

    private final long retryAfterSeconds;

    public QueryRateLimitedException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
