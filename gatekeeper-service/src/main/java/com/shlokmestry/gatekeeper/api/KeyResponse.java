package com.shlokmestry.gatekeeper.api;

import java.time.Instant;

import com.shlokmestry.gatekeeper.keys.ApiKey;

public record KeyResponse(
        long id,
        String key,
        boolean active,
        Instant expiresAt,
        String ownerName,
        String contactName,
        String contactEmail,
        Instant createdAt,
        Instant updatedAt
) {

    static KeyResponse from(ApiKey k) {
        return new KeyResponse(k.id(), k.token(), k.active(), k.expiresAt(), k.ownerName(), k.contactName(),
                k.contactEmail(), k.createdAt(), k.updatedAt());
    }
}
