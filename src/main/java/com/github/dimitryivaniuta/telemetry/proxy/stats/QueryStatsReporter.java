package com.github.dimitryivaniuta.telemetry.proxy.stats;

import com.github.dimitryivaniuta.telemetry.proxy.client.QueryClientProvider;
import com.github.dimitryivaniuta.telemetry.proxy.executor.QueryExecutor;
import com.github.dimitryivaniuta.telemetry.proxy.ratelimit.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;

/**
 * Read-only snapshot of throttle occupancy and cache settings.
 */
@RequiredArgsConstructor
public class QueryStatsReporter {

    private final SlidingWindowRateLimiter rateLimiter;
    private final QueryExecutor executor;
    private final QueryClientProvider clientProvider;

    public QueryStats stats() {
        return new QueryStats(
                rateLimiter.currentRate(),
                rateLimiter.getMaxRequests(),
                rateLimiter.getWindow().toSeconds(),
                executor.getDefaultTtl().toSeconds(),
                executor.getHistoricalTtl().toSeconds(),
                clientProvider.isAvailable()
        );
    }
}
