package com.shlokmestry.gatekeeper.keys;

import java.time.Instant;

public record KeyUpdate(
        Boolean active,
        String ownerName,
        String contactName,
        String contactEmail,
        Instant expiresAt,
        boolean clearExpiry
) {

    public KeyUpdate {
        if (clearExpiry && expiresAt != null) {
            throw new IllegalArgumentException("expiresAt and clearExpiry are mutually exclusive");
        }
    }
}
