package com.github.dimitryivaniuta.telemetry.proxy.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.dimitryivaniuta.telemetry.proxy.cache.CacheKeys;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCache;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCodec;
import com.github.dimitryivaniuta.telemetry.proxy.executor.QueryExecutor;
import com.github.dimitryivaniuta.telemetry.proxy.metrics.TelemetryProxyMetrics;
import com.github.dimitryivaniuta.telemetry.proxy.ratelimit.QueryRateLimitedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fetches the latest value of many metrics (or alarms) of one device with a single query.
 *
 * <p>The generated query matches names by substring, so engine-side names may differ from the
 * requested ones (for example by a path prefix). Rows are mapped back to the requested names:
 * <ol>
 *   <li>exact name match</li>
 *   <li>otherwise the engine name contains the requested name or the other way round;
 *       among several candidates the one closest in length wins, then the first in
 *       engine row order</li>
 * </ol>
 * Requested names without any match are left out of the result.
 *
 * <p>This class caches the resolved mapping itself and runs the raw query uncached.
 */
@Slf4j
@RequiredArgsConstructor
public class BatchLatestResolver {

    private static final TypeReference<LinkedHashMap<String, LatestValue>> RESOLVED = new TypeReference<>() {};

    private final QueryExecutor executor;
    private final ResultCache cache;
    private final ResultCodec codec;
    private final TelemetryProxyMetrics metrics;

    /**
     * @throws IllegalArgumentException if names are given but {@code serial} is blank
     * @throws QueryRateLimitedException when the outbound limit is reached
     */
    public Map<String, LatestValue> resolve(String serial, Collection<String> names, MetricKind kind, boolean useCache) {
        if (names == null || names.isEmpty()) {
            return Map.of();
        }
        if (serial == null || serial.isBlank()) {
            throw new IllegalArgumentException("serial must not be blank");
        }

        Set<String> requested = new LinkedHashSet<>(names);
        String cacheKey = CacheKeys.forBatch(kind.cachePrefix(), serial, requested);

        if (useCache) {
            Optional<LinkedHashMap<String, LatestValue>> cached = cache.get(cacheKey).flatMap(p -> codec.decode(p, RESOLVED));
            if (cached.isPresent() && !cached.get().isEmpty()) {
                log.debug("Batch {} cache HIT for {}", kind.cachePrefix(), serial);
                metrics.cacheHit(kind.cachePrefix());
                return cached.get();
            }
            metrics.cacheMiss(kind.cachePrefix());
        }

        String query = LatestValueQueryBuilder.build(kind, serial, requested);
        List<Map<String, Object>> rows = executor.run(query, false, null);

        Map<String, LatestValue> resolved = match(requested, indexByName(rows, kind));

        // an empty mapping would be read back as a miss anyway
        if (useCache && !resolved.isEmpty()) {
            codec.encode(resolved).ifPresent(p -> cache.put(cacheKey, p, executor.getDefaultTtl()));
        }

        metrics.batchResolved(kind.cachePrefix(), requested.size(), resolved.size());
        log.info("Batch query returned {}/{} {} names for {}", resolved.size(), requested.size(),
                kind.name().toLowerCase(), serial);
        return resolved;
    }

    static LinkedHashMap<String, LatestValue> indexByName(List<Map<String, Object>> rows, MetricKind kind) {
        LinkedHashMap<String, LatestValue> byName = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object name = row.get(LatestValueQueryBuilder.NAME_COLUMN);
            if (name == null || name.toString().isEmpty()) continue;
            byName.put(name.toString(), new LatestValue(
                    row.get(kind.valueColumn()),
                    row.get(LatestValueQueryBuilder.TIME_COLUMN)
            ));
        }
        return byName;
    }

    static Map<String, LatestValue> match(Collection<String> requested, LinkedHashMap<String, LatestValue> byName) {
        Map<String, LatestValue> resolved = new LinkedHashMap<>();
        for (String name : requested) {
            LatestValue exact = byName.get(name);
            if (exact != null) {
                resolved.put(name, exact);
                continue;
            }

            LatestValue best = null;
            int bestDistance = Integer.MAX_VALUE;
            for (Map.Entry<String, LatestValue> e : byName.entrySet()) {
                String engineName = e.getKey();
                if (!engineName.contains(name) && !name.contains(engineName)) continue;
                int distance = Math.abs(engineName.length() - name.length());
                if (distance < bestDistance) {
                    best = e.getValue();
                    bestDistance = distance;
                }
            }
            if (best != null) {
                resolved.put(name, best);
            }
        }
        return resolved;
    }
}
