package com.github.dimitryivaniuta.telemetry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.telemetry.proxy.TelemetryProxyProperties;
import com.github.dimitryivaniuta.telemetry.proxy.cache.CaffeineResultCache;
import com.github.dimitryivaniuta.telemetry.proxy.cache.RedisResultCache;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCache;
import com.github.dimitryivaniuta.telemetry.proxy.cache.ResultCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Result cache backend:
 * - Caffeine local cache (default), TTL per entry
 * - Redis when {@code telemetry-proxy.cache.backend=redis}, for several proxy instances
 *   sharing cached results
 */
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(prefix = "telemetry-proxy.cache", name = "backend", havingValue = "caffeine", matchIfMissing = true)
    public ResultCache caffeineResultCache(TelemetryProxyProperties props) {
        return new CaffeineResultCache(
                Caffeine.newBuilder()
                        .maximumSize(props.getCache().getMaxEntries())
                        .recordStats()
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "telemetry-proxy.cache", name = "backend", havingValue = "redis")
    public ResultCache redisResultCache(StringRedisTemplate redis) {
        return new RedisResultCache(redis);
    }

    @Bean
    public ResultCodec resultCodec(ObjectMapper objectMapper) {
        return new ResultCodec(objectMapper);
    }
}
