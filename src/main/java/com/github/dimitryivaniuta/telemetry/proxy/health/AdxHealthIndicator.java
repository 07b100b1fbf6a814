package com.github.dimitryivaniuta.telemetry.proxy.health;

import com.github.dimitryivaniuta.telemetry.proxy.client.QueryClientProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports ADX configuration and client state. Never reports DOWN: without a client the proxy
 * keeps serving (empty results), so it stays in rotation.
 */
@RequiredArgsConstructor
public class AdxHealthIndicator implements HealthIndicator {

    private final QueryClientProvider clientProvider;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("configured", clientProvider.isConfigured())
                .withDetail("clientAvailable", clientProvider.isAvailable())
                .build();
    }
}
