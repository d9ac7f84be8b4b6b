package com.shlokmestry.gatekeeper.api;

import java.time.Instant;

public record UpdateBanRequest(
        String title,
        String description,
        Boolean active,
        Instant expiresAt,
        Boolean clearExpiry
) {}
