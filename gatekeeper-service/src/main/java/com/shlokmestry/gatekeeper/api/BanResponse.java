package com.shlokmestry.gatekeeper.api;

import java.time.Instant;
import java.util.List;

import com.shlokmestry.gatekeeper.bans.Ban;
import com.shlokmestry.gatekeeper.bans.NetworkRange;

public record BanResponse(
        long id,
        String title,
        String description,
        boolean active,
        Instant expiresAt,
        Instant createdAt,
        Instant updatedAt,
        List<RangeResponse> ranges
) {

    public record RangeResponse(long id, long banId, String cidr) {
        static RangeResponse from(NetworkRange r) {
            return new RangeResponse(r.id(), r.banId(), r.cidr().toString());
        }
    }

    static BanResponse from(Ban b) {
        return new BanResponse(b.id(), b.title(), b.description(), b.active(), b.expiresAt(), b.createdAt(),
                b.updatedAt(), b.ranges().stream().map(RangeResponse::from).toList());
    }
}
