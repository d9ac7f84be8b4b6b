package com.shlokmestry.gatekeeper.keys;

import java.time.Instant;

public record ApiKey(
        long id,
        String token,
        boolean active,
        Instant expiresAt,      // null = never expires
        String ownerName,
        String contactName,
        String contactEmail,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isUsableAt(Instant now) {
        return active && (expiresAt == null || now.isBefore(expiresAt));
    }

    ApiKey withUpdate(KeyUpdate u, Instant now) {
        return new ApiKey(
                id,
                token,
                u.active() == null ? active : u.active(),
                u.clearExpiry() ? null : u.expiresAt() == null ? expiresAt : u.expiresAt(),
                u.ownerName() == null ? ownerName : u.ownerName(),
                u.contactName() == null ? contactName : u.contactName(),
                u.contactEmail() == null ? contactEmail : u.contactEmail(),
                createdAt,
                now
        );
    }
}
