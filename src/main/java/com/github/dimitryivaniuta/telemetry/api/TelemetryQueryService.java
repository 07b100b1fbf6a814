package com.github.dimitryivaniuta.telemetry.api;

import com.github.dimitryivaniuta.telemetry.api.dto.BatchTelemetryResponse;
import com.github.dimitryivaniuta.telemetry.proxy.batch.BatchLatestResolver;
import com.github.dimitryivaniuta.telemetry.proxy.batch.LatestValue;
import com.github.dimitryivaniuta.telemetry.proxy.batch.MetricKind;
import com.github.dimitryivaniuta.telemetry.proxy.executor.QueryExecutor;
import com.github.dimitryivaniuta.telemetry.proxy.ratelimit.QueryRateLimitedException;
import com.github.dimitryivaniuta.telemetry.proxy.stats.QueryStats;
import com.github.dimitryivaniuta.telemetry.proxy.stats.QueryStatsReporter;
import com.github.dimitryivaniuta.telemetry.proxy.support.KqlSupport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the query layer for the web tier. Every method may throw
 * {@link QueryRateLimitedException}; any other failure shows up as missing data.
 */
@Service
@RequiredArgsConstructor
public class TelemetryQueryService {

    private final QueryExecutor executor;
    private final BatchLatestResolver batchResolver;
    private final QueryStatsReporter statsReporter;

    /**
     * Ad hoc query.
     *
     * @param ttl cache TTL for this result; {@code null} means the default (live) TTL
     */
    public List<Map<String, Object>> executeQuery(String kql, boolean useCache, Duration ttl) {
        return executor.run(kql, useCache, ttl);
    }

    public List<Map<String, Object>> executeQuery(String kql, boolean useCache, boolean historical) {
        return executeQuery(kql, useCache, historical ? executor.getHistoricalTtl() : null);
    }

    public Map<String, List<Map<String, Object>>> executeMany(Collection<String> queries, boolean useCache) {
        return executor.runMany(queries, useCache);
    }

    public Map<String, LatestValue> batchLatest(String serial, Collection<String> names, MetricKind kind, boolean useCache) {
        return batchResolver.resolve(serial, names, kind, useCache);
    }

    /**
     * Telemetry and alarm values of one device: at most one engine query per non-empty list.
     */
    public BatchTelemetryResponse batchTelemetry(String serial,
                                                 Collection<String> telemetryNames,
                                                 Collection<String> alarmNames) {
        int queryCount = 0;

        Map<String, LatestValue> telemetry = Map.of();
        if (telemetryNames != null && !telemetryNames.isEmpty()) {
            telemetry = batchLatest(serial, telemetryNames, MetricKind.TELEMETRY, true);
            queryCount++;
        }

        Map<String, LatestValue> alarms = Map.of();
        if (alarmNames != null && !alarmNames.isEmpty()) {
            alarms = batchLatest(serial, alarmNames, MetricKind.ALARM, true);
            queryCount++;
        }

        QueryStats stats = stats();
        return new BatchTelemetryResponse(
                telemetry,
                alarms,
                new BatchTelemetryResponse.Meta(queryCount, stats.queriesInWindow(), stats.maxPerWindow())
        );
    }

    /**
     * First device info row whose serial contains {@code serial}.
     */
    public Optional<Map<String, Object>> findDevice(String serial) {
        String kql = "DevInfo | where comms_serial contains " + KqlSupport.literal(serial.trim()) + " | limit 1";
        return executor.run(kql).stream().findFirst();
    }

    public QueryStats stats() {
        return statsReporter.stats();
    }
}
