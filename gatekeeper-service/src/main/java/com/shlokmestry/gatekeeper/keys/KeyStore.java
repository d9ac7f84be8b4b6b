package com.shlokmestry.gatekeeper.keys;

import java.time.Instant;
import java.util.Optional;

public interface KeyStore {

    // throws TokenCollisionException when the token is already held
    ApiKey create(NewKey key, String token, Instant now);

    Optional<ApiKey> findById(long id);

    Optional<ApiKey> findByToken(String token);

    void update(ApiKey key);
}
