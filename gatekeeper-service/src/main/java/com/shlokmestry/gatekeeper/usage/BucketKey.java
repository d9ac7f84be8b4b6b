package com.shlokmestry.gatekeeper.usage;

import java.net.InetAddress;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

import com.shlokmestry.gatekeeper.net.IpAddresses;

public record BucketKey(long keyId, InetAddress address, String endpoint, Instant minute) {

    public static final long NO_KEY = -1L;
    public static final String NO_ENDPOINT = "&&--";

    public BucketKey {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(minute, "minute");
    }

    public static BucketKey normalized(Long keyId, InetAddress address, String endpoint, Instant timestamp) {
        if (keyId != null && keyId < 0) {
            throw new IllegalArgumentException("keyId must be positive: " + keyId);
        }
        if (NO_ENDPOINT.equals(endpoint)) {
            throw new IllegalArgumentException("endpoint name is reserved: " + endpoint);
        }
        return new BucketKey(
                keyId == null ? NO_KEY : keyId,
                address,
                endpoint == null ? NO_ENDPOINT : endpoint,
                timestamp.truncatedTo(ChronoUnit.MINUTES)
        );
    }

    public Optional<Long> key() {
        return keyId == NO_KEY ? Optional.empty() : Optional.of(keyId);
    }

    public Optional<String> endpointName() {
        return NO_ENDPOINT.equals(endpoint) ? Optional.empty() : Optional.of(endpoint);
    }

    // endpoint last: it is the only free-form part, and '|' never occurs in an address
    public String storageKey() {
        return "agg:" + minute.toEpochMilli() + ":" + keyId + ":" + IpAddresses.canonical(address) + "|" + endpoint;
    }
}
