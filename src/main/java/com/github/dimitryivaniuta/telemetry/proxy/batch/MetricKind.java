package com.github.dimitryivaniuta.telemetry.proxy.batch;

/**
 * The two "latest value per name" sources. Both match names by substring; they differ in
 * the table, the KQL operator and the value column.
 */
public enum MetricKind {

    TELEMETRY("Telemetry", "contains", "value_double", "batch_telemetry"),
    ALARM("Alarms", "has", "value", "batch_alarms");

    private final String table;
    private final String nameOperator;
    private final String valueColumn;
    private final String cachePrefix;

    MetricKind(String table, String nameOperator, String valueColumn, String cachePrefix) {
        this.table = table;
        this.nameOperator = nameOperator;
        this.valueColumn = valueColumn;
        this.cachePrefix = cachePrefix;
    }

    public String table() { return table; }

    public String nameOperator() { return nameOperator; }

    public String valueColumn() { return valueColumn; }

    public String cachePrefix() { return cachePrefix; }
}
