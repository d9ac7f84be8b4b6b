package com.shlokmestry.gatekeeper.api;

import java.time.Instant;

import jakarta.validation.constraints.Email;

public record CreateKeyRequest(
        Boolean active,             // defaults to true
        String ownerName,
        String contactName,
        @Email String contactEmail,
        Instant expiresAt
) {}
