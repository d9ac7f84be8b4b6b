package com.shlokmestry.gatekeeper.keys;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "gatekeeper.store", havingValue = "memory")
public class InMemoryKeyStore implements KeyStore {

    private final AtomicLong seq = new AtomicLong();
    private final Map<Long, ApiKey> byId = new ConcurrentHashMap<>();
    private final Map<String, Long> idByToken = new ConcurrentHashMap<>();

    @Override
    public ApiKey create(NewKey key, String token, Instant now) {
        long id = seq.incrementAndGet();
        if (idByToken.putIfAbsent(token, id) != null) {
            throw new TokenCollisionException();
        }
        ApiKey created = new ApiKey(id, token, key.active(), key.expiresAt(),
                key.ownerName(), key.contactName(), key.contactEmail(), now, now);
        byId.put(id, created);
        return created;
    }

    @Override
    public Optional<ApiKey> findById(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<ApiKey> findByToken(String token) {
        Long id = idByToken.get(token);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public void update(ApiKey key) {
        byId.computeIfPresent(key.id(), (id, old) -> key);
    }
}
