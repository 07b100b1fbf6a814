package com.github.dimitryivaniuta.telemetry.proxy.client;

import java.util.List;
import java.util.Map;

/**
 * Handle to the backing query engine. Implementations must be safe to share across threads.
 */
public interface QueryEngine {

    /**
     * Runs a query and returns the primary result table as column name to value rows.
     */
    List<Map<String, Object>> execute(String database, String query) throws QueryExecutionException;
}
