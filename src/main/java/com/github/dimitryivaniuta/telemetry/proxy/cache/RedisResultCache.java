package com.github.dimitryivaniuta.telemetry.proxy.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Networked {@link ResultCache} for deployments with several proxy instances.
 * Expiry is owned by Redis ({@code SET key value EX ttl}).
 */
@RequiredArgsConstructor
public final class RedisResultCache implements ResultCache {

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void put(String key, String payload, Duration ttl) {
        redis.opsForValue().set(key, payload, CaffeineResultCache.clamp(ttl));
    }
}
