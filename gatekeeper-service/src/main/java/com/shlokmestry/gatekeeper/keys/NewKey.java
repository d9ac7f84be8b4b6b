package com.shlokmestry.gatekeeper.keys;

import java.time.Instant;

public record NewKey(
        boolean active,
        String ownerName,
        String contactName,
        String contactEmail,
        Instant expiresAt
) {}
