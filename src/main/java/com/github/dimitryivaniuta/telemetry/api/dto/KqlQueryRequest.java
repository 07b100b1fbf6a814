package com.github.dimitryivaniuta.telemetry.api.dto;

import jakarta.validation.constraints.NotBlank;

public record KqlQueryRequest(
        @NotBlank String kql,
        Boolean useCache,
        Boolean historical
) {}
