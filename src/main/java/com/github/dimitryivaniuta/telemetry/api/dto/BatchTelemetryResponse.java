package com.github.dimitryivaniuta.telemetry.api.dto;

import com.github.dimitryivaniuta.telemetry.proxy.batch.LatestValue;

import java.util.Map;

public record BatchTelemetryResponse(
        Map<String, LatestValue> telemetry,
        Map<String, LatestValue> alarms,
        Meta meta
) {
    public record Meta(
            int queryCount,
            int queriesLastMinute,
            int rateLimitMax
    ) {}
}
