package com.github.dimitryivaniuta.telemetry.proxy.client;

import com.github.dimitryivaniuta.telemetry.proxy.TelemetryProxyProperties;
import com.github.dimitryivaniuta.telemetry.proxy.metrics.TelemetryProxyMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Lazily builds the shared {@link QueryClient} and hands the same instance to every caller.
 *
 * <p>The first read is unlocked. Construction happens at most once under {@link #lock};
 * once a client exists it is never replaced or torn down.
 *
 * <p>Missing configuration and construction errors are logged and reported as
 * {@link Optional#empty()}. Whether the next call tries again is decided by
 * {@link ClientInitFailurePolicy}.
 */
@Slf4j
public class QueryClientProvider {

    private final TelemetryProxyProperties.Adx adx;
    private final TelemetryProxyProperties.Client clientProps;
    private final QueryEngineFactory factory;
    private final TelemetryProxyMetrics metrics;
    private final Clock clock;

    private final Object lock = new Object();

    private volatile QueryClient client;
    private volatile Instant lastFailureAt;

    public QueryClientProvider(TelemetryProxyProperties props,
                               QueryEngineFactory factory,
                               TelemetryProxyMetrics metrics,
                               Clock clock) {
        this.adx = props.getAdx();
        this.clientProps = props.getClient();
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.metrics = metrics;
        this.clock = clock;
    }

    public Optional<QueryClient> getOrCreate() {
        QueryClient c = client;
        if (c != null) return Optional.of(c);

        synchronized (lock) {
            c = client;
            if (c != null) return Optional.of(c);
            if (inBackoff()) return Optional.empty();

            try {
                AdxConnectionSettings settings = AdxConnectionSettings.from(adx);
                QueryEngine engine = factory.create(settings);
                if (engine == null) {
                    throw new IllegalStateException("QueryEngineFactory returned null");
                }
                c = new QueryClient(engine, settings.database());
                client = c;
                lastFailureAt = null;
                log.info("ADX client initialized for cluster={} database={}", settings.clusterUri(), settings.database());
                return Optional.of(c);
            } catch (IncompleteConfigurationException ex) {
                log.warn("ADX configuration incomplete - missing {}", ex.getMissingKeys());
                recordFailure("configuration_incomplete");
                return Optional.empty();
            } catch (Exception ex) {
                log.error("Failed to initialize ADX client: {}", ex.getMessage(), ex);
                recordFailure("construction_failed");
                return Optional.empty();
            }
        }
    }

    /**
     * True once a client has been built. Never triggers construction.
     */
    public boolean isAvailable() {
        return client != null;
    }

    public boolean isConfigured() {
        return AdxConnectionSettings.isComplete(adx);
    }

    private boolean inBackoff() {
        if (clientProps.getInitFailurePolicy() != ClientInitFailurePolicy.BACKOFF) return false;
        Instant failedAt = lastFailureAt;
        if (failedAt == null) return false;
        Duration backoff = clientProps.getInitFailureBackoff();
        return backoff != null && clock.instant().isBefore(failedAt.plus(backoff));
    }

    private void recordFailure(String reason) {
        lastFailureAt = clock.instant();
        metrics.clientInitFailed(reason);
    }
}
