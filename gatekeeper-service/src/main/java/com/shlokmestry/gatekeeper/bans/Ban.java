package com.shlokmestry.gatekeeper.bans;

import java.time.Instant;
import java.util.List;

public record Ban(
        long id,
        String title,
        String description,
        boolean active,
        Instant expiresAt,      // null = until retired
        Instant createdAt,
        Instant updatedAt,
        List<NetworkRange> ranges
) {

    public Ban {
        ranges = List.copyOf(ranges);
    }

    public boolean isLiveAt(Instant now) {
        return active && (expiresAt == null || now.isBefore(expiresAt));
    }

    Ban withRanges(List<NetworkRange> newRanges) {
        return new Ban(id, title, description, active, expiresAt, createdAt, updatedAt, newRanges);
    }

    Ban withUpdate(BanUpdate u, Instant now) {
        return new Ban(
                id,
                u.title() == null ? title : u.title(),
                u.description() == null ? description : u.description(),
                u.active() == null ? active : u.active(),
                u.clearExpiry() ? null : u.expiresAt() == null ? expiresAt : u.expiresAt(),
                createdAt,
                now,
                ranges
        );
    }
}
