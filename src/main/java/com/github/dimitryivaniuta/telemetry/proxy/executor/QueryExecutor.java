package com.github.dimitryivaniuta.telemetry.proxy.executor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.dimitryivaniuta.telemetry.proxy.cache.CacheKeys;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCache;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCodec;
import com.github.dimitryivaniuta.telemetry.proxy.client.QueryClient;
import com.github.dimitryivaniuta.telemetry.proxy.client.QueryClientProvider;
import com.github.dimitryivaniuta.telemetry.proxy.client.QueryExecutionException;
import com.github.dimitryivaniuta.telemetry.proxy.metrics.TelemetryProxyMetrics;
import com.github.dimitryivaniuta.telemetry.proxy.ratelimit.QueryRateLimitedException;
import com.github.dimitryivaniuta.telemetry.proxy.ratelimit.SlidingWindowRateLimiter;
import com.github.dimitryivaniuta.telemetry.proxy.support.KqlSupport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one query string through cache, admission control and the engine.
 *
 * <p>Order per call:
 * <ol>
 *   <li>cache lookup (a hit skips everything else)</li>
 *   <li>rate limiter; a denial is raised as {@link QueryRateLimitedException}</li>
 *   <li>client lookup; no client means an empty result</li>
 *   <li>engine execution; a failure means an empty result</li>
 *   <li>cache write on success</li>
 * </ol>
 *
 * <p>Only rate limiting is surfaced to callers. Unavailable client and execution failures are
 * told apart in logs and in {@code telemetry_proxy_query_failures_total}.
 */
@Slf4j
public class QueryExecutor {

    static final String CACHE_KIND = "query";
    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

    private final ResultCache cache;
    private final ResultCodec codec;
    private final SlidingWindowRateLimiter rateLimiter;
    private final QueryClientProvider clientProvider;
    private final TelemetryProxyMetrics metrics;

    @Getter
    private final Duration defaultTtl;
    @Getter
    private final Duration historicalTtl;

    public QueryExecutor(ResultCache cache,
                         ResultCodec codec,
                         SlidingWindowRateLimiter rateLimiter,
                         QueryClientProvider clientProvider,
                         TelemetryProxyMetrics metrics,
                         Duration defaultTtl,
                         Duration historicalTtl) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.clientProvider = Objects.requireNonNull(clientProvider, "clientProvider must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        this.historicalTtl = Objects.requireNonNull(historicalTtl, "historicalTtl must not be null");
    }

    public List<Map<String, Object>> run(String query) {
        return run(query, true, null);
    }

    public List<Map<String, Object>> runHistorical(String query) {
        return run(query, true, historicalTtl);
    }

    /**
     * @param ttlOverride TTL for the cache write; {@code null} means the default TTL
     * @throws QueryRateLimitedException when the query would exceed the outbound limit
     */
    public List<Map<String, Object>> run(String query, boolean useCache, Duration ttlOverride) {
        Objects.requireNonNull(query, "query must not be null");
        String key = CacheKeys.forQuery(query);

        if (useCache) {
            Optional<List<Map<String, Object>>> cached = readCached(key);
            if (cached.isPresent()) return cached.get();
        }
        return execute(query, key, useCache, ttlOverride);
    }

    /**
     * Serves cache hits first, then runs every miss individually. No queries are merged here.
     * The map keeps the iteration order of {@code queries}.
     */
    public Map<String, List<Map<String, Object>>> runMany(Collection<String> queries, boolean useCache) {
        Map<String, List<Map<String, Object>>> results = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();

        for (String query : queries) {
            if (results.containsKey(query)) continue;
            if (useCache) {
                Optional<List<Map<String, Object>>> cached = readCached(CacheKeys.forQuery(query));
                if (cached.isPresent()) {
                    results.put(query, cached.get());
                    continue;
                }
            }
            // reserve position so the result keeps caller order
            results.put(query, null);
            misses.add(query);
        }

        for (String query : misses) {
            results.put(query, execute(query, CacheKeys.forQuery(query), useCache, null));
        }
        return results;
    }

    public int currentRate() {
        return rateLimiter.currentRate();
    }

    private Optional<List<Map<String, Object>>> readCached(String key) {
        Optional<List<Map<String, Object>>> hit = cache.get(key).flatMap(p -> codec.decode(p, ROWS));
        if (hit.isPresent()) {
            log.debug("Cache HIT for query hash: {}", CacheKeys.shortForm(key));
            metrics.cacheHit(CACHE_KIND);
        } else {
            log.debug("Cache MISS for query hash: {}", CacheKeys.shortForm(key));
            metrics.cacheMiss(CACHE_KIND);
        }
        return hit;
    }

    private List<Map<String, Object>> execute(String query, String key, boolean useCache, Duration ttlOverride) {
        if (!rateLimiter.isAllowed()) {
            metrics.rateLimitRejected();
            log.warn("Query rejected due to rate limiting");
            throw new QueryRateLimitedException("Rate limit exceeded. Please try again later.",
                    rateLimiter.retryAfterSeconds());
        }
        metrics.rateLimitAllowed();

        Optional<QueryClient> client = clientProvider.getOrCreate();
        if (client.isEmpty()) {
            log.error("ADX client not available, returning no rows for: {}", KqlSupport.snippet(query));
            metrics.queryFailed("client_unavailable");
            return List.of();
        }

        List<Map<String, Object>> rows;
        long start = System.nanoTime();
        try {
            log.info("Executing ADX query (rate: {}/{} per {}s)",
                    rateLimiter.currentRate(), rateLimiter.getMaxRequests(), rateLimiter.getWindow().toSeconds());
            rows = client.get().execute(query);
            metrics.queryExecuted(rows.size());
        } catch (QueryExecutionException ex) {
            log.error("ADX query failed: {} | query: {}", ex.getMessage(), KqlSupport.snippet(query));
            metrics.queryFailed("execution");
            return List.of();
        } catch (RuntimeException ex) {
            log.error("ADX query failed unexpectedly | query: {}", KqlSupport.snippet(query), ex);
            metrics.queryFailed("execution");
            return List.of();
        } finally {
            metrics.recordDuration("telemetry_proxy_query_duration_seconds", System.nanoTime() - start);
        }

        if (useCache) {
            Duration ttl = ttlOverride != null ? ttlOverride : defaultTtl;
            codec.encode(rows).ifPresent(payload -> {
                cache.put(key, payload, ttl);
                log.debug("Cached result for query hash: {} (TTL: {}s)", CacheKeys.shortForm(key), ttl.toSeconds());
            });
        }
        log.debug("Returning {} rows", rows.size());
        return rows;
    }
}
