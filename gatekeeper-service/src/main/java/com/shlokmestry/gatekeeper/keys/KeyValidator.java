package com.shlokmestry.gatekeeper.keys;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

@Service
public class KeyValidator {

    private final KeyStore store;
    private final Clock clock;

    public KeyValidator(KeyStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Optional<Long> validate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return store.findByToken(token.trim())
                .filter(k -> k.isUsableAt(clock.instant()))
                .map(ApiKey::id);
    }
}
