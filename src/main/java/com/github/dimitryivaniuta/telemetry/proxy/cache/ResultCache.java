package com.github.dimitryivaniuta.telemetry.proxy.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL-aware store for serialized query results.
 *
 * <p>Implementations must be safe for concurrent use. A miss is a normal outcome and is
 * reported as {@link Optional#empty()}; entries older than their TTL are never returned.
 */
public interface ResultCache {

    Optional<String> get(String key);

    void put(String key, String payload, Duration ttl);
}
