package com.shlokmestry.gatekeeper.keys;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.shlokmestry.gatekeeper.observability.GatekeeperMetrics;

@Service
public class KeyService {

    private static final Logger log = LoggerFactory.getLogger(KeyService.class);

    private final KeyStore store;
    private final TokenGenerator tokens;
    private final Clock clock;
    private final GatekeeperMetrics metrics;
    private final int maxCreateAttempts;

    public KeyService(KeyStore store, TokenGenerator tokens, Clock clock, GatekeeperMetrics metrics,
                      @Value("${gatekeeper.keys.create-max-attempts:3}") int maxCreateAttempts) {
        if (maxCreateAttempts < 1) {
            throw new IllegalArgumentException("maxCreateAttempts must be >= 1");
        }
        this.store = store;
        this.tokens = tokens;
        this.clock = clock;
        this.metrics = metrics;
        this.maxCreateAttempts = maxCreateAttempts;
    }

    public ApiKey createKey(NewKey key) {
        for (int attempt = 1; attempt <= maxCreateAttempts; attempt++) {
            try {
                ApiKey created = store.create(key, tokens.next(), clock.instant());
                log.info("key create keyId={} owner={} active={} expiresAt={}",
                        created.id(), created.ownerName(), created.active(), created.expiresAt());
                return created;
            } catch (TokenCollisionException e) {
                metrics.tokenCollision();
                log.warn("key create token_collision attempt={}/{}", attempt, maxCreateAttempts);
            }
        }
        throw new IllegalStateException("Could not generate a unique key token after " + maxCreateAttempts + " attempts");
    }

    public ApiKey getKey(long id) {
        return store.findById(id).orElseThrow(() -> new KeyNotFoundException(id));
    }

    public ApiKey updateKey(long id, KeyUpdate update) {
        Instant now = clock.instant();
        ApiKey updated = getKey(id).withUpdate(update, now);
        store.update(updated);
        log.info("key update keyId={} active={} expiresAt={}", id, updated.active(), updated.expiresAt());
        return updated;
    }

    public ApiKey deactivateKey(long id) {
        return updateKey(id, new KeyUpdate(false, null, null, null, null, false));
    }
}
