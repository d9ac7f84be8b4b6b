package com.shlokmestry.gatekeeper.usage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "gatekeeper.store", havingValue = "memory")
public class InMemoryAggregateStore implements AggregateStore {

    private final ConcurrentHashMap<BucketKey, AggregateBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public boolean upsert(BucketKey key, StatusClass statusClass, long elapsedMillis, long bytes) {
        boolean[] created = new boolean[1];
        buckets.compute(key, (k, existing) -> {
            if (existing == null) {
                created[0] = true;
                existing = AggregateBucket.empty(k);
            }
            return existing.plus(statusClass, elapsedMillis, bytes);
        });
        return created[0];
    }

    @Override
    public Optional<AggregateBucket> find(BucketKey key) {
        return Optional.ofNullable(buckets.get(key));
    }

    @Override
    public List<AggregateBucket> bucketsForMinute(Instant minute) {
        return buckets.values().stream()
                .filter(b -> b.key().minute().equals(minute))
                .toList();
    }

    public int size() {
        return buckets.size();
    }
}
