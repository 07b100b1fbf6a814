package com.github.dimitryivaniuta.telemetry.proxy.batch;

/**
 * Most recent value of one metric or alarm. Either field may be {@code null}.
 */
public record LatestValue(
        Object value,
        Object localtime
) {}
