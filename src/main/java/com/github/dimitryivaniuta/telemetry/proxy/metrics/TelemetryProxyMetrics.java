package com.github.dimitryivaniuta.telemetry.proxy.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class TelemetryProxyMetrics {

    private final MeterRegistry registry;

    public TelemetryProxyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Rate limiting ----
    public void rateLimitRejected() {
        Counter.builder("telemetry_proxy_ratelimit_rejected_total")
                .register(registry)
                .increment();
    }

    public void rateLimitAllowed() {
        Counter.builder("telemetry_proxy_ratelimit_allowed_total")
                .register(registry)
                .increment();
    }

    // ---- Cache ----
    public void cacheHit(String cacheKind) {
        Counter.builder("telemetry_proxy_cache_hits_total")
                .tag("kind", cacheKind) // query | batch_telemetry | batch_alarms
                .register(registry)
                .increment();
    }

    public void cacheMiss(String cacheKind) {
        Counter.builder("telemetry_proxy_cache_misses_total")
                .tag("kind", cacheKind)
                .register(registry)
                .increment();
    }

    // ---- Engine ----
    public void queryExecuted(int rows) {
        Counter.builder("telemetry_proxy_query_executed_total")
                .register(registry)
                .increment();
        DistributionSummary.builder("telemetry_proxy_query_rows")
                .register(registry)
                .record(rows);
    }

    public void queryFailed(String reason) {
        Counter.builder("telemetry_proxy_query_failures_total")
                .tag("reason", reason) // client_unavailable | execution
                .register(registry)
                .increment();
    }

    public void clientInitFailed(String reason) {
        Counter.builder("telemetry_proxy_client_init_failures_total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    // ---- Batch ----
    public void batchResolved(String kind, int requested, int matched) {
        Counter.builder("telemetry_proxy_batch_requested_names_total")
                .tag("kind", kind)
                .register(registry)
                .increment(requested);
        Counter.builder("telemetry_proxy_batch_matched_names_total")
                .tag("kind", kind)
                .register(registry)
                .increment(matched);
    }

    // ---- Duration ----
    public void recordDuration(String metricName, long nanos) {
        Timer.builder(metricName)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
