package com.github.dimitryivaniuta.telemetry.proxy.batch;

import com.github.dimitryivaniuta.telemetry.proxy.support.KqlSupport;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Builds the single KQL query that returns the newest row per name for one device.
 */
public final class LatestValueQueryBuilder {
    private LatestValueQueryBuilder() {}

    public static final String SERIAL_COLUMN = "comms_serial";
    public static final String NAME_COLUMN = "name";
    public static final String TIME_COLUMN = "localtime";

    public static String build(MetricKind kind, String serial, Collection<String> names) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("names must not be empty");
        }
        String namesFilter = names.stream()
                .map(n -> NAME_COLUMN + " " + kind.nameOperator() + " " + KqlSupport.literal(n))
                .collect(Collectors.joining(" or "));

        return kind.table() + "\n"
                + "| where " + SERIAL_COLUMN + " contains " + KqlSupport.literal(serial) + "\n"
                + "| where " + namesFilter + "\n"
                + "| summarize arg_max(" + TIME_COLUMN + ", " + kind.valueColumn() + ") by " + NAME_COLUMN + "\n"
                + "| project " + NAME_COLUMN + ", " + TIME_COLUMN + ", " + kind.valueColumn();
    }
}
