package com.github.dimitryivaniuta.telemetry.proxy.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An engine handle bound to the configured database.
 */
public final class QueryClient {

    private final QueryEngine engine;
    private final String database;

    public QueryClient(QueryEngine engine, String database) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    public List<Map<String, Object>> execute(String query) throws QueryExecutionException {
        List<Map<String, Object>> rows = engine.execute(database, query);
        return rows != null ? rows : List.of();
    }

    public String database() {
        return database;
    }
}
