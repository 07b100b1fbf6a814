package com.github.dimitryivaniuta.telemetry.proxy;

import com.github.dimitryivaniuta.telemetry.proxy.client.ClientInitFailurePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "telemetry-proxy")
public class TelemetryProxyProperties {

    private final Adx adx = new Adx();
    private final Cache cache = new Cache();
    private final RateLimit rateLimit = new RateLimit();
    private final Client client = new Client();

    /**
     * Connection values for the backing ADX cluster. All five are required;
     * if any is missing the proxy runs without live querying.
     */
    @Getter
    @Setter
    public static class Adx {
        private String clusterUri;
        private String database;
        private String clientId;
        private String clientSecret;
        private String tenantId;
    }

    @Getter
    @Setter
    public static class Cache {
        private Backend backend = Backend.CAFFEINE;
        private Duration defaultTtl = Duration.ofSeconds(30);
        private Duration historicalTtl = Duration.ofMinutes(5);
        private long maxEntries = 50_000;

        public enum Backend {
            CAFFEINE,
            REDIS
        }
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int maxRequests = 60;
        private Duration window = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Client {
        private ClientInitFailurePolicy initFailurePolicy = ClientInitFailurePolicy.RETRY_EVERY_CALL;
        // only used with BACKOFF
        private Duration initFailureBackoff = Duration.ofSeconds(30);
    }
}
