package com.github.dimitryivaniuta.telemetry.proxy.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * In-process {@link ResultCache} on Caffeine with per-entry expiry.
 *
 * <p>Each entry carries its own TTL, so live and historical results share one cache.
 * TTL is clamped to avoid accidental huge or zero values.
 *
 * <p>Caffeine builders are mutable: pass a fresh builder, it is consumed here.
 */
public final class CaffeineResultCache implements ResultCache {

    static final Duration MIN_TTL = Duration.ofSeconds(1);
    static final Duration MAX_TTL = Duration.ofHours(24); // safety cap

    private final Cache<String, TimedPayload> cache;

    public CaffeineResultCache(Caffeine<Object, Object> builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        this.cache = builder
                .expireAfter(new PerEntryExpiry())
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        TimedPayload hit = cache.getIfPresent(key);
        return hit == null ? Optional.empty() : Optional.of(hit.payload());
    }

    @Override
    public void put(String key, String payload, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        cache.put(key, new TimedPayload(payload, clamp(ttl)));
    }

    public CacheStats stats() {
        return cache.stats();
    }

    static Duration clamp(Duration ttl) {
        if (ttl == null || ttl.compareTo(MIN_TTL) < 0) return MIN_TTL;
        return ttl.compareTo(MAX_TTL) > 0 ? MAX_TTL : ttl;
    }

    private record TimedPayload(String payload, Duration ttl) {}

    private static final class PerEntryExpiry implements Expiry<String, TimedPayload> {

        @Override
        public long expireAfterCreate(String key, TimedPayload value, long currentTime) {
            return value.ttl().toNanos();
        }

        // overwrite restarts the TTL
        @Override
        public long expireAfterUpdate(String key, TimedPayload value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, TimedPayload value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
