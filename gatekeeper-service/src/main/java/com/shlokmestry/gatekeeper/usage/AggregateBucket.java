package com.shlokmestry.gatekeeper.usage;

public record AggregateBucket(
        BucketKey key,
        long requestCount,
        long sumElapsedMillis,
        long sumBytes,
        long sum2xx,
        long sum3xx,
        long sum4xx,
        long sum429,
        long sum5xx
) {

    public static AggregateBucket empty(BucketKey key) {
        return new AggregateBucket(key, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public AggregateBucket plus(StatusClass statusClass, long elapsedMillis, long bytes) {
        return new AggregateBucket(
                key,
                requestCount + 1,
                sumElapsedMillis + elapsedMillis,
                sumBytes + bytes,
                sum2xx + (statusClass == StatusClass.STATUS_2XX ? 1 : 0),
                sum3xx + (statusClass == StatusClass.STATUS_3XX ? 1 : 0),
                sum4xx + (statusClass == StatusClass.STATUS_4XX ? 1 : 0),
                sum429 + (statusClass == StatusClass.STATUS_429 ? 1 : 0),
                sum5xx + (statusClass == StatusClass.STATUS_5XX ? 1 : 0)
        );
    }
}
