package com.shlokmestry.gatekeeper.usage;

import java.net.InetAddress;
import java.time.Instant;

public record UsageEvent(
        Long keyId,             // null = anonymous
        InetAddress address,
        String endpoint,        // null = no named endpoint
        Instant timestamp,
        int statusCode,
        long elapsedMillis,
        long responseBytes
) {}
