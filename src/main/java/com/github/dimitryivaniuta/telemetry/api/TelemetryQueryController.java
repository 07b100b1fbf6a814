package com.github.dimitryivaniuta.telemetry.api;

import com.github.dimitryivaniuta.telemetry.api.dto.BatchTelemetryRequest;
import com.github.dimitryivaniuta.telemetry.api.dto.BatchTelemetryResponse;
import com.github.dimitryivaniuta.telemetry.api.dto.KqlQueryRequest;
import com.github.dimitryivaniuta.telemetry.api.dto.MultiQueryRequest;
import com.github.dimitryivaniuta.telemetry.api.dto.SerialSearchRequest;
import com.github.dimitryivaniuta.telemetry.proxy.stats.QueryStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/telemetry")
public class TelemetryQueryController {

    private final TelemetryQueryService queryService;

    @PostMapping("/query")
    public List<Map<String, Object>> query(@Valid @RequestBody KqlQueryRequest req) {
        return queryService.executeQuery(
                req.kql(),
                !Boolean.FALSE.equals(req.useCache()),
                Boolean.TRUE.equals(req.historical())
        );
    }

    @PostMapping("/query/many")
    public Map<String, List<Map<String, Object>>> queryMany(@Valid @RequestBody MultiQueryRequest req) {
        return queryService.executeMany(req.queries(), !Boolean.FALSE.equals(req.useCache()));
    }

    @PostMapping("/batch")
    public BatchTelemetryResponse batch(@Valid @RequestBody BatchTelemetryRequest req) {
        boolean noTelemetry = req.telemetryNames() == null || req.telemetryNames().isEmpty();
        boolean noAlarms = req.alarmNames() == null || req.alarmNames().isEmpty();
        if (noTelemetry && noAlarms) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "At least one of telemetryNames or alarmNames is required");
        }
        return queryService.batchTelemetry(req.serial().trim(), req.telemetryNames(), req.alarmNames());
    }

    @PostMapping("/devices/search")
    public Map<String, Object> searchDevice(@Valid @RequestBody SerialSearchRequest req) {
        return queryService.findDevice(req.serial())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No serial number found"));
    }

    @GetMapping("/stats")
    public QueryStats stats() {
        return queryService.stats();
    }
}
