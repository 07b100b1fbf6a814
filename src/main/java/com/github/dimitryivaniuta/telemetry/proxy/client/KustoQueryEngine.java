package com.github.dimitryivaniuta.telemetry.proxy.client;

import com.microsoft.azure.kusto.data.Client;
import com.microsoft.azure.kusto.data.KustoOperationResult;
import com.microsoft.azure.kusto.data.KustoResultColumn;
import com.microsoft.azure.kusto.data.KustoResultSetTable;
import com.microsoft.azure.kusto.data.exceptions.DataClientException;
import com.microsoft.azure.kusto.data.exceptions.DataServiceException;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryEngine} backed by the Azure Kusto data client.
 */
@RequiredArgsConstructor
public final class KustoQueryEngine implements QueryEngine {

    private final Client client;

    @Override
    public List<Map<String, Object>> execute(String database, String query) throws QueryExecutionException {
        KustoOperationResult result;
        try {
            result = client.execute(database, query);
        } catch (DataServiceException | DataClientException ex) {
            throw new QueryExecutionException("ADX query failed: " + ex.getMessage(), ex);
        }

        KustoResultSetTable table = result.getPrimaryResults();
        if (table == null) {
            return List.of();
        }

        KustoResultColumn[] columns = table.getColumns();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (table.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.length; i++) {
                row.put(columns[i].getColumnName(), table.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }
}
