package com.github.dimitryivaniuta.telemetry.proxy.client;

@FunctionalInterface
public interface QueryEngineFactory {

    QueryEngine create(AdxConnectionSettings settings) throws Exception;
}
