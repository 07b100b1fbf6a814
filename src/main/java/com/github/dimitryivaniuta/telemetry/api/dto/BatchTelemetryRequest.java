package com.github.dimitryivaniuta.telemetry.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Latest values for one device. At least one of the two name lists must be non-empty.
 * The snake_case names are what the dashboard widgets send.
 */
public record BatchTelemetryRequest(
        @NotBlank String serial,
        @JsonAlias("telemetry_names") List<@NotBlank String> telemetryNames,
        @JsonAlias("alarm_names") List<@NotBlank String> alarmNames
) {}
