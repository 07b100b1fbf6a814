package com.github.dimitryivaniuta.telemetry.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SerialSearchRequest(
        @NotBlank @Size(max = 64) String serial
) {}
