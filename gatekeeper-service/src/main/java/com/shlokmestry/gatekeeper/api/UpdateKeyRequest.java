package com.shlokmestry.gatekeeper.api;

import java.time.Instant;

import jakarta.validation.constraints.Email;

public record UpdateKeyRequest(
        Boolean active,
        String ownerName,
        String contactName,
        @Email String contactEmail,
        Instant expiresAt,
        Boolean clearExpiry
) {}
