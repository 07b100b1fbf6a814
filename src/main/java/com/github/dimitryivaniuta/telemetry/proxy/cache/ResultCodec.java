package com.github.dimitryivaniuta.telemetry.proxy.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * JSON encoding of cached payloads.
 *
 * <p>A payload that cannot be decoded is treated as a miss, so a stale format left in a shared
 * backend never breaks a request.
 */
@Slf4j
@RequiredArgsConstructor
public class ResultCodec {

    private final ObjectMapper mapper;

    public Optional<String> encode(Object value) {
        try {
            return Optional.of(mapper.writeValueAsString(value));
        } catch (JsonProcessingException ex) {
            log.warn("Cannot serialize cache payload: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    public <T> Optional<T> decode(String payload, TypeReference<T> type) {
        try {
            return Optional.ofNullable(mapper.readValue(payload, type));
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring undecodable cache payload: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }
}
