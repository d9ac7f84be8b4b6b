package com.shlokmestry.gatekeeper.usage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AggregateStore {

    boolean upsert(BucketKey key, StatusClass statusClass, long elapsedMillis, long bytes);

    Optional<AggregateBucket> find(BucketKey key);

    List<AggregateBucket> bucketsForMinute(Instant minute);
}
