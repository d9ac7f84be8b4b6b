package com.shlokmestry.gatekeeper.keys;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import com.shlokmestry.gatekeeper.store.RedisStoreSupport;

@Repository
@ConditionalOnProperty(name = "gatekeeper.store", havingValue = "redis", matchIfMissing = true)
public class RedisKeyStore extends RedisStoreSupport implements KeyStore {

    private static final String SEQ = "key:seq";
    private static final String PREFIX = "key:";
    private static final String TOKEN_PREFIX = "key:token:";

    public RedisKeyStore(StringRedisTemplate redis) {
        super(redis);
    }

    private static String key(long id) {
        return PREFIX + id;
    }

    private static String tokenKey(String token) {
        return TOKEN_PREFIX + token;
    }

    @Override
    public ApiKey create(NewKey key, String token, Instant now) {
        return call("key.create", () -> {
            long id = nextId(SEQ);
            Boolean claimed = redis.opsForValue().setIfAbsent(tokenKey(token), String.valueOf(id));
            if (!Boolean.TRUE.equals(claimed)) {
                throw new TokenCollisionException();
            }
            ApiKey created = new ApiKey(id, token, key.active(), key.expiresAt(),
                    key.ownerName(), key.contactName(), key.contactEmail(), now, now);
            redis.opsForHash().putAll(key(id), fields(created));
            return created;
        });
    }

    @Override
    public Optional<ApiKey> findById(long id) {
        return call("key.findById", () -> read(id));
    }

    @Override
    public Optional<ApiKey> findByToken(String token) {
        return call("key.findByToken", () -> {
            String id = redis.opsForValue().get(tokenKey(token));
            return id == null ? Optional.<ApiKey>empty() : read(Long.parseLong(id));
        });
    }

    @Override
    public void update(ApiKey key) {
        call("key.update", () -> {
            Map<String, String> fields = fields(key);
            fields.remove("token");
            redis.opsForHash().putAll(key(key.id()), fields);
            if (key.expiresAt() == null) {
                redis.opsForHash().delete(key(key.id()), "expiresAt");
            }
            return null;
        });
    }

    private Optional<ApiKey> read(long id) {
        Map<Object, Object> m = redis.opsForHash().entries(key(id));
        if (m == null || m.isEmpty()) return Optional.empty();

        return Optional.of(new ApiKey(
                id,
                string(m, "token"),
                bool(m, "active"),
                instant(m, "expiresAt"),
                string(m, "ownerName"),
                string(m, "contactName"),
                string(m, "contactEmail"),
                instant(m, "createdAt"),
                instant(m, "updatedAt")
        ));
    }

    private static Map<String, String> fields(ApiKey k) {
        // Map.of() rejects nulls, so only put what is present.
        Map<String, String> f = new HashMap<>();
        f.put("token", k.token());
        f.put("active", String.valueOf(k.active()));
        if (k.expiresAt() != null) f.put("expiresAt", millis(k.expiresAt()));
        if (k.ownerName() != null) f.put("ownerName", k.ownerName());
        if (k.contactName() != null) f.put("contactName", k.contactName());
        if (k.contactEmail() != null) f.put("contactEmail", k.contactEmail());
        f.put("createdAt", millis(k.createdAt()));
        f.put("updatedAt", millis(k.updatedAt()));
        return f;
    }
}
