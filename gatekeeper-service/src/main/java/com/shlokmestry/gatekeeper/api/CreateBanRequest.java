package com.shlokmestry.gatekeeper.api;

import java.time.Instant;
import java.util.List;

import jakarta.validation.constraints.NotBlank;

public record CreateBanRequest(
        @NotBlank String title,
        String description,
        Boolean active,             // defaults to true
        Instant expiresAt,
        List<@NotBlank String> ranges   // e.g. "10.0.0.0/24", "2001:db8::/32"
) {}
