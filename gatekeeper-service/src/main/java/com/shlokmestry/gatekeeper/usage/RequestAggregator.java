package com.shlokmestry.gatekeeper.usage;

import java.net.InetAddress;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shlokmestry.gatekeeper.observability.GatekeeperMetrics;

@Service
public class RequestAggregator {

    private static final Logger log = LoggerFactory.getLogger(RequestAggregator.class);

    private final AggregateStore store;
    private final GatekeeperMetrics metrics;

    public RequestAggregator(AggregateStore store, GatekeeperMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public BucketKey recordEvent(UsageEvent event) {
        if (event.elapsedMillis() < 0 || event.responseBytes() < 0) {
            throw new IllegalArgumentException("elapsedMillis and responseBytes must be >= 0");
        }
        BucketKey key = BucketKey.normalized(event.keyId(), event.address(), event.endpoint(), event.timestamp());
        StatusClass statusClass = StatusClass.of(event.statusCode()).orElse(null);

        boolean created = store.upsert(key, statusClass, event.elapsedMillis(), event.responseBytes());
        metrics.usageRecorded(statusClass);

        if (created) {
            log.debug("aggregate create keyId={} address={} endpoint={} minute={}",
                    key.keyId(), key.address().getHostAddress(), key.endpoint(), key.minute());
        }
        return key;
    }

    // whole minutes, from and to both inclusive
    public long requestCount(Long keyId, InetAddress address, Instant from, Instant to) {
        long wantedKey = keyId == null ? BucketKey.NO_KEY : keyId;
        long total = 0;
        Instant minute = from.truncatedTo(ChronoUnit.MINUTES);
        Instant last = to.truncatedTo(ChronoUnit.MINUTES);
        while (!minute.isAfter(last)) {
            for (AggregateBucket b : store.bucketsForMinute(minute)) {
                if (b.key().keyId() == wantedKey && b.key().address().equals(address)) {
                    total += b.requestCount();
                }
            }
            minute = minute.plus(1, ChronoUnit.MINUTES);
        }
        return total;
    }
}
