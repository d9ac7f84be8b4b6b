package com.shlokmestry.gatekeeper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.InetAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.shlokmestry.gatekeeper.bans.Ban;
import com.shlokmestry.gatekeeper.bans.BanNotFoundException;
import com.shlokmestry.gatekeeper.bans.BanService;
import com.shlokmestry.gatekeeper.bans.BanStore;
import com.shlokmestry.gatekeeper.bans.BanUpdate;
import com.shlokmestry.gatekeeper.bans.NetworkRange;
import com.shlokmestry.gatekeeper.bans.RedisBanStore;
import com.shlokmestry.gatekeeper.keys.ApiKey;
import com.shlokmestry.gatekeeper.keys.KeyService;
import com.shlokmestry.gatekeeper.keys.KeyStore;
import com.shlokmestry.gatekeeper.keys.KeyUpdate;
import com.shlokmestry.gatekeeper.keys.KeyValidator;
import com.shlokmestry.gatekeeper.keys.NewKey;
import com.shlokmestry.gatekeeper.keys.RedisKeyStore;
import com.shlokmestry.gatekeeper.keys.TokenCollisionException;
import com.shlokmestry.gatekeeper.net.CidrRangeIndex;
import com.shlokmestry.gatekeeper.net.IpAddresses;
import com.shlokmestry.gatekeeper.usage.AggregateBucket;
import com.shlokmestry.gatekeeper.usage.AggregateStore;
import com.shlokmestry.gatekeeper.usage.BucketKey;
import com.shlokmestry.gatekeeper.usage.RedisAggregateStore;
import com.shlokmestry.gatekeeper.usage.RequestAggregator;
import com.shlokmestry.gatekeeper.usage.UsageEvent;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "gatekeeper.store=redis"
)
@Testcontainers
class RedisStoresIT {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", REDIS::getHost);
        registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379));
    }

    private static final InetAddress ADDR = IpAddresses.parse("198.51.100.23");
    private static final Instant T = Instant.parse("2024-05-01T12:00:10Z");
    private static final Instant MINUTE = Instant.parse("2024-05-01T12:00:00Z");

    @Autowired StringRedisTemplate redis;
    @Autowired RequestAggregator aggregator;
    @Autowired AggregateStore aggregates;
    @Autowired BanService bans;
    @Autowired BanStore banStore;
    @Autowired CidrRangeIndex index;
    @Autowired KeyService keys;
    @Autowired KeyStore keyStore;
    @Autowired KeyValidator validator;

    @BeforeEach
    void flush() {
        redis.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        bans.rebuildIndex();
    }

    private BucketKey record(Long keyId, String endpoint, Instant at, int status, long elapsed, long bytes) {
        return aggregator.recordEvent(new UsageEvent(keyId, ADDR, endpoint, at, status, elapsed, bytes));
    }

    @Test
    void redisStoresAreTheOnesWired() {
        assertThat(aggregates).isInstanceOf(RedisAggregateStore.class);
        assertThat(banStore).isInstanceOf(RedisBanStore.class);
        assertThat(keyStore).isInstanceOf(RedisKeyStore.class);
    }

    @Test
    void concurrentEventsForOneTupleLandInExactlyOneBucket() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int base = t * perThread;
                futures.add(pool.submit(() -> {
                    start.await();
                    long sent = 0;
                    for (int i = 0; i < perThread; i++) {
                        long elapsed = base + i;
                        record(null, "search", T.plusMillis(i * 100L), i % 2 == 0 ? 200 : 429, elapsed, 3 * elapsed);
                        sent += elapsed;
                    }
                    return sent;
                }));
            }
            start.countDown();

            long expectedElapsed = 0;
            for (Future<Long> f : futures) {
                expectedElapsed += f.get(60, TimeUnit.SECONDS);
            }

            List<AggregateBucket> minute = aggregates.bucketsForMinute(MINUTE);
            assertThat(minute).hasSize(1);

            AggregateBucket b = aggregates.find(BucketKey.normalized(null, ADDR, "search", T)).orElseThrow();
            long total = (long) threads * perThread;
            assertThat(b.requestCount()).isEqualTo(total);
            assertThat(b.sumElapsedMillis()).isEqualTo(expectedElapsed);
            assertThat(b.sumBytes()).isEqualTo(3 * expectedElapsed);
            assertThat(b.sum2xx()).isEqualTo(total / 2);
            assertThat(b.sum429()).isEqualTo(total / 2);
            assertThat(b.sum4xx()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void anonymousTrafficIsIsolatedFromKeyedTraffic() {
        BucketKey anon = record(null, "orders", T, 200, 5, 50);
        record(null, "orders", T.plusSeconds(20), 503, 7, 0);
        BucketKey keyed = record(9L, "orders", T.plusSeconds(30), 404, 1, 10);
        BucketKey noEndpoint = record(null, null, T.plusSeconds(40), 302, 2, 0);

        AggregateBucket a = aggregates.find(anon).orElseThrow();
        assertThat(a.key().key()).isEmpty();
        assertThat(a.key().endpoint()).isEqualTo("orders");
        assertThat(a.requestCount()).isEqualTo(2);
        assertThat(a.sumElapsedMillis()).isEqualTo(12);
        assertThat(a.sum2xx()).isEqualTo(1);
        assertThat(a.sum5xx()).isEqualTo(1);

        AggregateBucket k = aggregates.find(keyed).orElseThrow();
        assertThat(k.key().key()).contains(9L);
        assertThat(k.requestCount()).isEqualTo(1);
        assertThat(k.sum4xx()).isEqualTo(1);

        AggregateBucket n = aggregates.find(noEndpoint).orElseThrow();
        assertThat(n.key().endpointName()).isEmpty();
        assertThat(n.sum3xx()).isEqualTo(1);

        assertThat(aggregates.bucketsForMinute(MINUTE)).hasSize(3);
        assertThat(aggregator.requestCount(9L, ADDR, MINUTE, MINUTE)).isEqualTo(1);
    }

    @Test
    void ipv6BucketsReadBackWithTheirAddress() {
        InetAddress v6 = IpAddresses.parse("2001:db8::5");
        BucketKey key = aggregator.recordEvent(new UsageEvent(2L, v6, "search", T, 200, 1, 1));

        assertThat(aggregates.find(key).orElseThrow().key().address()).isEqualTo(v6);
    }

    @Test
    void retireRemovesTheBanAndEveryRangeFromRedis() {
        Ban ban = bans.createBan("scrapers", "bulk", List.of("192.0.2.0/24", "2001:db8::/32", "10.0.0.0/8"), null);
        List<Long> rangeIds = ban.ranges().stream().map(NetworkRange::id).toList();
        assertThat(redis.opsForSet().members("ban:" + ban.id() + ":ranges")).hasSize(3);
        assertThat(index.isBanned("2001:db8::1")).isTrue();

        bans.retireBan(ban.id());

        assertThat(redis.hasKey("ban:" + ban.id())).isFalse();
        assertThat(redis.hasKey("ban:" + ban.id() + ":ranges")).isFalse();
        for (long rangeId : rangeIds) {
            assertThat(redis.hasKey("range:" + rangeId)).isFalse();
            assertThat(banStore.findRange(rangeId)).isEmpty();
        }
        assertThat(redis.opsForSet().isMember("ban:ids", String.valueOf(ban.id()))).isFalse();
        assertThat(index.isBanned("192.0.2.1")).isFalse();
        assertThat(index.isBanned("2001:db8::1")).isFalse();
        assertThat(index.isBanned("10.1.1.1")).isFalse();
    }

    @Test
    void rebuildRestoresTheIndexFromRedis() {
        Ban live = bans.createBan("live", null, List.of("203.0.113.0/24", "2001:db8:1::/48"), null);
        bans.createBan("draft", null, false, List.of("198.51.100.0/24"), null);
        index.replaceAll(List.of());
        assertThat(index.isBanned("203.0.113.9")).isFalse();

        assertThat(bans.rebuildIndex()).isEqualTo(1);

        assertThat(index.isBanned("203.0.113.9")).isTrue();
        assertThat(index.isBanned("2001:db8:1::9")).isTrue();
        assertThat(index.isBanned("198.51.100.9")).isFalse();
        assertThat(bans.getBan(live.id()).ranges().stream().map(r -> r.cidr().toString()).toList())
                .containsExactly("203.0.113.0/24", "2001:db8:1:0:0:0:0:0/48");
    }

    @Test
    void rangesAddedAndRemovedThroughRedis() {
        Ban ban = bans.createBan("t", null, List.of("10.0.0.0/24"), null);

        NetworkRange added = bans.addRangeToBan(ban.id(), "10.9.0.0/16");
        assertThat(index.isBanned("10.9.3.3")).isTrue();
        assertThat(bans.getBan(ban.id()).ranges()).hasSize(2);

        bans.removeRange(added.id());
        assertThat(index.isBanned("10.9.3.3")).isFalse();
        assertThat(redis.hasKey("range:" + added.id())).isFalse();
        assertThat(bans.getBan(ban.id()).ranges()).hasSize(1);
    }

    @Test
    void addingARangeToAMissingBanIsNotFound() {
        Ban ban = bans.createBan("t", null, List.of(), null);
        bans.retireBan(ban.id());

        assertThatThrownBy(() -> bans.addRangeToBan(ban.id(), "10.0.0.0/8"))
                .isInstanceOf(BanNotFoundException.class);
    }

    @Test
    void clearingBanExpiryRemovesTheStoredField() {
        Ban ban = bans.createBan("temp", null, List.of("10.0.0.0/24"), Instant.now().plusSeconds(600));
        assertThat(redis.opsForHash().hasKey("ban:" + ban.id(), "expiresAt")).isTrue();

        bans.updateBan(ban.id(), new BanUpdate(null, null, null, null, true));

        assertThat(redis.opsForHash().hasKey("ban:" + ban.id(), "expiresAt")).isFalse();
        assertThat(bans.getBan(ban.id()).expiresAt()).isNull();
    }

    @Test
    void collidingTokenIsRefusedWithoutOverwritingTheHolder() {
        String token = "a".repeat(64);
        ApiKey first = keyStore.create(new NewKey(true, "Acme", null, null, null), token, Instant.now());

        assertThatThrownBy(() -> keyStore.create(new NewKey(true, "Other", null, null, null), token, Instant.now()))
                .isInstanceOf(TokenCollisionException.class);

        assertThat(redis.opsForValue().get("key:token:" + token)).isEqualTo(String.valueOf(first.id()));
        assertThat(keyStore.findByToken(token)).map(ApiKey::ownerName).contains("Acme");
    }

    @Test
    void keyLifecycleReadsBackThroughRedis() {
        ApiKey key = keys.createKey(new NewKey(true, "Acme", "Jo", "jo@acme.test", Instant.now().plusSeconds(600)));
        assertThat(validator.validate(key.token())).contains(key.id());
        ApiKey stored = keys.getKey(key.id());
        assertThat(stored.token()).isEqualTo(key.token());
        assertThat(stored.contactEmail()).isEqualTo("jo@acme.test");
        assertThat(stored.expiresAt()).isNotNull();

        ApiKey cleared = keys.updateKey(key.id(), new KeyUpdate(null, null, null, null, null, true));
        assertThat(cleared.expiresAt()).isNull();
        assertThat(redis.opsForHash().hasKey("key:" + key.id(), "expiresAt")).isFalse();
        assertThat(redis.opsForHash().get("key:" + key.id(), "token")).isEqualTo(key.token());

        keys.deactivateKey(key.id());
        assertThat(validator.validate(key.token())).isEmpty();
    }
}
