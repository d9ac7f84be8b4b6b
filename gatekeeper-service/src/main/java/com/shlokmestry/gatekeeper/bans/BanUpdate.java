package com.shlokmestry.gatekeeper.bans;

import java.time.Instant;

public record BanUpdate(
        String title,
        String description,
        Boolean active,
        Instant expiresAt,
        boolean clearExpiry
) {

    public BanUpdate {
        if (clearExpiry && expiresAt != null) {
            throw new IllegalArgumentException("expiresAt and clearExpiry are mutually exclusive");
        }
    }
}
