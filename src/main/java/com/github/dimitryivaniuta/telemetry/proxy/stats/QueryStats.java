package com.github.dimitryivaniuta.telemetry.proxy.stats;

public record QueryStats(
        int queriesInWindow,
        int maxPerWindow,
        long windowSeconds,
        long defaultTtlSeconds,
        long historicalTtlSeconds,
        boolean clientAvailable
) {}
