package com.shlokmestry.gatekeeper.usage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import com.shlokmestry.gatekeeper.net.IpAddresses;
import com.shlokmestry.gatekeeper.store.RedisStoreSupport;

@Repository
@ConditionalOnProperty(name = "gatekeeper.store", havingValue = "redis", matchIfMissing = true)
public class RedisAggregateStore extends RedisStoreSupport implements AggregateStore {

    private static final String MINUTE_INDEX_PREFIX = "agg:minute:";

    private final RedisScript<Long> upsertScript;

    public RedisAggregateStore(StringRedisTemplate redis) {
        super(redis);
        this.upsertScript = RedisScript.of(new ClassPathResource("lua/aggregate_upsert.lua"), Long.class);
    }

    private static String minuteIndex(Instant minute) {
        return MINUTE_INDEX_PREFIX + minute.toEpochMilli();
    }

    @Override
    public boolean upsert(BucketKey key, StatusClass statusClass, long elapsedMillis, long bytes) {
        Long created = call("aggregate.upsert", () -> redis.execute(
                upsertScript,
                List.of(key.storageKey(), minuteIndex(key.minute())),
                String.valueOf(key.keyId()),
                IpAddresses.canonical(key.address()),
                key.endpoint(),
                String.valueOf(key.minute().toEpochMilli()),
                String.valueOf(elapsedMillis),
                String.valueOf(bytes),
                statusClass == null ? "" : statusClass.field()
        ));
        return created != null && created == 1L;
    }

    @Override
    public Optional<AggregateBucket> find(BucketKey key) {
        return call("aggregate.find", () -> read(key.storageKey()));
    }

    @Override
    public List<AggregateBucket> bucketsForMinute(Instant minute) {
        return call("aggregate.bucketsForMinute", () -> {
            Set<String> keys = redis.opsForSet().members(minuteIndex(minute));
            List<AggregateBucket> out = new ArrayList<>();
            if (keys == null) return out;
            for (String k : keys) {
                read(k).ifPresent(out::add);
            }
            return out;
        });
    }

    private Optional<AggregateBucket> read(String storageKey) {
        Map<Object, Object> m = redis.opsForHash().entries(storageKey);
        if (m == null || m.isEmpty()) return Optional.empty();

        BucketKey key = new BucketKey(
                number(m, "keyId"),
                IpAddresses.parse(string(m, "address")),
                string(m, "endpoint"),
                instant(m, "minute")
        );
        return Optional.of(new AggregateBucket(
                key,
                number(m, "requestCount"),
                number(m, "sumElapsedMillis"),
                number(m, "sumBytes"),
                number(m, StatusClass.STATUS_2XX.field()),
                number(m, StatusClass.STATUS_3XX.field()),
                number(m, StatusClass.STATUS_4XX.field()),
                number(m, StatusClass.STATUS_429.field()),
                number(m, StatusClass.STATUS_5XX.field())
        ));
    }
}
