package com.github.dimitryivaniuta.telemetry.proxy.client;

import com.microsoft.azure.kusto.data.ClientFactory;
import com.microsoft.azure.kusto.data.auth.ConnectionStringBuilder;

/**
 * Builds a Kusto client authenticated with an AAD application key.
 */
public final class KustoQueryEngineFactory implements QueryEngineFactory {

    @Override
    public QueryEngine create(AdxConnectionSettings settings) throws Exception {
        ConnectionStringBuilder csb = ConnectionStringBuilder.createWithAadApplicationCredentials(
                settings.clusterUri(),
                settings.clientId(),
                settings.clientSecret(),
                settings.tenantId()
        );
        return new KustoQueryEngine(ClientFactory.createClient(csb));
    }
}
