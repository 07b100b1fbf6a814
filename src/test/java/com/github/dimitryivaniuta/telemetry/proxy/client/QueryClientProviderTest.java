package com.github.dimitryivaniuta.telemetry.proxy.client;

import com.github.dimitryivaniuta.telemetry.proxy.TelemetryProxyProperties;
import com.github.dimitryivaniuta.telemetry.proxy.metrics.TelemetryProxyMetrics;
import com.github.dimitryivaniuta.telemetry.support.FakeQueryEngine;
import com.github.dimitryivaniuta.telemetry.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class QueryClientProviderTest {

    private final MutableClock clock = MutableClock.atEpoch();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AtomicInteger constructions = new AtomicInteger();

    private static TelemetryProxyProperties completeProps() {
        TelemetryProxyProperties props = new TelemetryProxyProperties();
        props.getAdx().setClusterUri("https://cluster.westeurope.kusto.windows.net");
        props.getAdx().setDatabase("telemetry");
        props.getAdx().setClientId("app-id");
        props.getAdx().setClientSecret("secret");
        props.getAdx().setTenantId("tenant");
        return props;
    }

    private QueryClientProvider provider(TelemetryProxyProperties props, QueryEngineFactory factory) {
        return new QueryClientProvider(props, factory, new TelemetryProxyMetrics(registry), clock);
    }

    private QueryEngineFactory countingFactory() {
        return settings -> {
            constructions.incrementAndGet();
            return new FakeQueryEngine();
        };
    }

    @Test
    void shouldBuildOnceAndReturnSameHandle() {
        QueryClientProvider provider = provider(completeProps(), countingFactory());
        assertThat(provider.isAvailable()).isFalse();

        QueryClient first = provider.getOrCreate().orElseThrow();
        QueryClient second = provider.getOrCreate().orElseThrow();

        assertThat(second).isSameAs(first);
        assertThat(first.database()).isEqualTo("telemetry");
        assertThat(constructions).hasValue(1);
        assertThat(provider.isAvailable()).isTrue();
    }

    @Test
    void missingConfigurationShouldYieldAbsentClientWithoutCallingFactory() {
        TelemetryProxyProperties props = completeProps();
        props.getAdx().setTenantId(" ");

        QueryClientProvider provider = provider(props, countingFactory());

        assertThat(provider.getOrCreate()).isEmpty();
        assertThat(provider.isConfigured()).isFalse();
        assertThat(constructions).hasValue(0);
        assertThat(registry.counter("telemetry_proxy_client_init_failures_total",
                "reason", "configuration_incomplete").count()).isEqualTo(1.0);
    }

    @Test
    void missingConfigurationShouldBeRecheckedOnEveryCallByDefault() {
        TelemetryProxyProperties props = completeProps();
        props.getAdx().setDatabase("");
        QueryClientProvider provider = provider(props, countingFactory());

        assertThat(provider.getOrCreate()).isEmpty();
        assertThat(provider.getOrCreate()).isEmpty();
        assertThat(registry.counter("telemetry_proxy_client_init_failures_total",
                "reason", "configuration_incomplete").count()).isEqualTo(2.0);

        props.getAdx().setDatabase("telemetry");

        assertThat(provider.getOrCreate()).isPresent();
        assertThat(constructions).hasValue(1);
    }

    @Test
    void constructionErrorShouldBeSwallowedAndRetriedOnNextCallByDefault() {
        QueryEngineFactory flaky = settings -> {
            if (constructions.incrementAndGet() == 1) throw new IllegalStateException("AAD unreachable");
            return new FakeQueryEngine();
        };
        QueryClientProvider provider = provider(completeProps(), flaky);

        assertThat(provider.getOrCreate()).isEmpty();
        assertThat(provider.getOrCreate()).isPresent();
        assertThat(constructions).hasValue(2);
    }

    @Test
    void backoffPolicyShouldSkipConstructionUntilBackoffElapsed() {
        TelemetryProxyProperties props = completeProps();
        props.getClient().setInitFailurePolicy(ClientInitFailurePolicy.BACKOFF);
        props.getClient().setInitFailureBackoff(Duration.ofSeconds(30));

        QueryEngineFactory failing = settings -> {
            constructions.incrementAndGet();
            throw new IllegalStateException("boom");
        };
        QueryClientProvider provider = provider(props, failing);

        assertThat(provider.getOrCreate()).isEmpty();
        clock.advanceSeconds(10);
        assertThat(provider.getOrCreate()).isEmpty();
        assertThat(constructions).hasValue(1);

        clock.advanceSeconds(21);
        assertThat(provider.getOrCreate()).isEmpty();
        assertThat(constructions).hasValue(2);
    }

    @Test
    void concurrentCallersShouldTriggerSingleConstruction() throws Exception {
        QueryEngineFactory slow = settings -> {
            constructions.incrementAndGet();
            Thread.sleep(50);
            return new FakeQueryEngine();
        };
        QueryClientProvider provider = provider(completeProps(), slow);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Optional<QueryClient>>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) tasks.add(provider::getOrCreate);

            QueryClient first = null;
            for (Future<Optional<QueryClient>> f : pool.invokeAll(tasks)) {
                QueryClient c = f.get().orElseThrow();
                if (first == null) first = c;
                assertThat(c).isSameAs(first);
            }
            assertThat(constructions).hasValue(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void settingsToStringShouldNotLeakSecret() throws Exception {
        AdxConnectionSettings settings = AdxConnectionSettings.from(completeProps().getAdx());
        assertThat(settings.toString()).doesNotContain("secret");
    }
}
