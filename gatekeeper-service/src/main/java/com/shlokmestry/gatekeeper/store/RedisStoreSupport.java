package com.shlokmestry.gatekeeper.store;

import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

public abstract class RedisStoreSupport {

    protected final StringRedisTemplate redis;

    protected RedisStoreSupport(StringRedisTemplate redis) {
        this.redis = redis;
    }

    protected <T> T call(String operation, Supplier<T> fn) {
        try {
            return fn.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }

    protected long nextId(String sequenceKey) {
        Long id = redis.opsForValue().increment(sequenceKey);
        if (id == null) {
            // only happens inside a pipeline/transaction, which we never open here
            throw new IllegalStateException("INCR returned null for " + sequenceKey);
        }
        return id;
    }

    protected static String millis(Instant instant) {
        return String.valueOf(instant.toEpochMilli());
    }

    protected static Instant instant(Map<Object, Object> m, String field) {
        Object v = m.get(field);
        return v == null ? null : Instant.ofEpochMilli(Long.parseLong((String) v));
    }

    protected static String string(Map<Object, Object> m, String field) {
        return (String) m.get(field);
    }

    protected static boolean bool(Map<Object, Object> m, String field) {
        return Boolean.parseBoolean((String) m.get(field));
    }

    protected static long number(Map<Object, Object> m, String field) {
        Object v = m.get(field);
        return v == null ? 0L : Long.parseLong((String) v);
    }
}
