package com.github.dimitryivaniuta.telemetry.config;

import com.github.dimitryivaniuta.telemetry.proxy.TelemetryProxyProperties;
import com.github.dimitryivaniuta.telemetry.proxy.batch.BatchLatestResolver;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCache;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCodec;
import com.github.dimitryivaniuta.telemetry.proxy.client.KustoQueryEngineFactory;
import com.github.dimitryivaniuta.telemetry.proxy.client.QueryClientProvider;
import com.github.dimitryivaniuta.telemetry.proxy.client.QueryEngineFactory;
import com.github.dimitryivaniuta.telemetry.proxy.executor.QueryExecutor;
import com.github.dimitryivaniuta.telemetry.proxy.health.AdxHealthIndicator;
import com.github.dimitryivaniuta.telemetry.proxy.metrics.TelemetryProxyMetrics;
import com.github.dimitryivaniuta.telemetry.proxy.ratelimit.SlidingWindowRateLimiter;
import com.github.dimitryivaniuta.telemetry.proxy.stats.QueryStatsReporter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composition root of the query layer. Every shared piece of state (rate limiter window,
 * client handle, result cache) is a single bean created here and injected where needed.
 *
 * <p>Call chain (outer -> inner):
 * <ol>
 *   <li>BatchLatestResolver: batch cache, one query per device and kind</li>
 *   <li>QueryExecutor: query cache, rate limiter, client</li>
 *   <li>QueryClientProvider: lazily built engine handle</li>
 * </ol>
 */
@Configuration
@EnableConfigurationProperties(TelemetryProxyProperties.class)
public class QueryProxyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SlidingWindowRateLimiter queryRateLimiter(TelemetryProxyProperties props, Clock clock) {
        TelemetryProxyProperties.RateLimit rl = props.getRateLimit();
        return new SlidingWindowRateLimiter(rl.getMaxRequests(), rl.getWindow(), clock);
    }

    @Bean
    public QueryEngineFactory queryEngineFactory() {
        return new KustoQueryEngineFactory();
    }

    @Bean
    public QueryClientProvider queryClientProvider(TelemetryProxyProperties props,
                                                   QueryEngineFactory queryEngineFactory,
                                                   TelemetryProxyMetrics metrics,
                                                   Clock clock) {
        return new QueryClientProvider(props, queryEngineFactory, metrics, clock);
    }

    @Bean
    public QueryExecutor queryExecutor(ResultCache resultCache,
                                       ResultCodec resultCodec,
                                       SlidingWindowRateLimiter queryRateLimiter,
                                       QueryClientProvider queryClientProvider,
                                       TelemetryProxyMetrics metrics,
                                       TelemetryProxyProperties props) {
        return new QueryExecutor(
                resultCache,
                resultCodec,
                queryRateLimiter,
                queryClientProvider,
                metrics,
                props.getCache().getDefaultTtl(),
                props.getCache().getHistoricalTtl()
        );
    }

    @Bean
    public BatchLatestResolver batchLatestResolver(QueryExecutor queryExecutor,
                                                   ResultCache resultCache,
                                                   ResultCodec resultCodec,
                                                   TelemetryProxyMetrics metrics) {
        return new BatchLatestResolver(queryExecutor, resultCache, resultCodec, metrics);
    }

    @Bean
    public QueryStatsReporter queryStatsReporter(SlidingWindowRateLimiter queryRateLimiter,
                                                 QueryExecutor queryExecutor,
                                                 QueryClientProvider queryClientProvider) {
        return new QueryStatsReporter(queryRateLimiter, queryExecutor, queryClientProvider);
    }

    @Bean
    public AdxHealthIndicator adxHealthIndicator(QueryClientProvider queryClientProvider) {
        return new AdxHealthIndicator(queryClientProvider);
    }
}
