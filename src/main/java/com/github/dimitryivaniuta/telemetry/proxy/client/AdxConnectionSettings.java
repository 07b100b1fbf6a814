package com.github.dimitryivaniuta.telemetry.proxy.client;

import com.github.dimitryivaniuta.telemetry.proxy.TelemetryProxyProperties;

import java.util.ArrayList;
import java.util.List;

public record AdxConnectionSettings(
        String clusterUri,
        String database,
        String clientId,
        String clientSecret,
        String tenantId
) {

    /**
     * Validates that all five connection values are present.
     *
     * @throws IncompleteConfigurationException listing every missing property
     */
    public static AdxConnectionSettings from(TelemetryProxyProperties.Adx adx) throws IncompleteConfigurationException {
        List<String> missing = new ArrayList<>();
        if (isBlank(adx.getClusterUri())) missing.add("cluster-uri");
        if (isBlank(adx.getDatabase())) missing.add("database");
        if (isBlank(adx.getClientId())) missing.add("client-id");
        if (isBlank(adx.getClientSecret())) missing.add("client-secret");
        if (isBlank(adx.getTenantId())) missing.add("tenant-id");
        if (!missing.isEmpty()) {
            throw new IncompleteConfigurationException(missing);
        }
        return new AdxConnectionSettings(
                adx.getClusterUri().trim(),
                adx.getDatabase().trim(),
                adx.getClientId().trim(),
                adx.getClientSecret(),
                adx.getTenantId().trim()
        );
    }

    public static boolean isComplete(TelemetryProxyProperties.Adx adx) {
        return !isBlank(adx.getClusterUri())
                && !isBlank(adx.getDatabase())
                && !isBlank(adx.getClientId())
                && !isBlank(adx.getClientSecret())
                && !isBlank(adx.getTenantId());
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }

    // keep the secret out of logs
    @Override
    public String toString() {
        return "AdxConnectionSettings[clusterUri=" + clusterUri + ", database=" + database
                + ", clientId=" + clientId + ", tenantId=" + tenantId + "]";
    }
}
