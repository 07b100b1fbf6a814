package com.github.dimitryivaniuta.telemetry.proxy.client;

import lombok.Getter;

import java.util.List;

@Getter
public class IncompleteConfigurationException extends Exception {

    private final List<String> missingKeys;

    public IncompleteConfigurationException(List<String> missingKeys) {
        super("ADX configuration incomplete, missing: " + String.join(", ", missingKeys));
        this.missingKeys = List.copyOf(missingKeys);
    }
}
