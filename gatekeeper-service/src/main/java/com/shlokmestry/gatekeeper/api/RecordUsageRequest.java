package com.shlokmestry.gatekeeper.api;

import java.time.Instant;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RecordUsageRequest(
        Long keyId,                     // from a prior /v1/authorize, absent for anonymous traffic
        @NotBlank String address,
        String endpoint,                // gateway endpoint name, absent if none matched
        @NotNull Instant timestamp,
        @NotNull Integer statusCode,
        @NotNull @Min(0) Long elapsedMillis,
        @NotNull @Min(0) Long responseBytes
) {}
