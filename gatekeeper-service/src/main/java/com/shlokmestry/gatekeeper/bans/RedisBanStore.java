package com.shlokmestry.gatekeeper.bans;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import com.shlokmestry.gatekeeper.net.Cidr;
import com.shlokmestry.gatekeeper.store.RedisStoreSupport;

// ban:ids          set of ban ids
// ban:{id}         hash of the scalar fields
// ban:{id}:ranges  set of range ids
// range:{id}       hash: banId, cidr
@Repository
@ConditionalOnProperty(name = "gatekeeper.store", havingValue = "redis", matchIfMissing = true)
public class RedisBanStore extends RedisStoreSupport implements BanStore {

    private static final String BAN_SEQ = "ban:seq";
    private static final String RANGE_SEQ = "range:seq";
    private static final String BAN_IDS = "ban:ids";
    private static final int MAX_WATCH_RETRIES = 5;

    public RedisBanStore(StringRedisTemplate redis) {
        super(redis);
    }

    private static String banKey(long id) {
        return "ban:" + id;
    }

    private static String rangesKey(long banId) {
        return "ban:" + banId + ":ranges";
    }

    private static String rangeKey(long rangeId) {
        return "range:" + rangeId;
    }

    @Override
    public Ban create(String title, String description, boolean active, Instant expiresAt, List<Cidr> ranges,
                      Instant now) {
        return call("ban.create", () -> {
            long id = nextId(BAN_SEQ);
            List<NetworkRange> children = new ArrayList<>(ranges.size());
            for (Cidr cidr : ranges) {
                children.add(new NetworkRange(nextId(RANGE_SEQ), id, cidr));
            }
            Ban ban = new Ban(id, title, description, active, expiresAt, now, now, children);

            redis.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.multi();
                    ops.opsForHash().putAll(banKey(id), banFields(ban));
                    for (NetworkRange r : children) {
                        ops.opsForHash().putAll(rangeKey(r.id()), rangeFields(r));
                        ops.opsForSet().add(rangesKey(id), String.valueOf(r.id()));
                    }
                    ops.opsForSet().add(BAN_IDS, String.valueOf(id));
                    return ops.exec();
                }
            });
            return ban;
        });
    }

    @Override
    public Optional<Ban> findById(long banId) {
        return call("ban.findById", () -> read(banId));
    }

    @Override
    public List<Ban> findAll() {
        return call("ban.findAll", () -> {
            Set<String> ids = redis.opsForSet().members(BAN_IDS);
            List<Ban> out = new ArrayList<>();
            if (ids == null) return out;
            for (String id : ids) {
                read(Long.parseLong(id)).ifPresent(out::add);
            }
            out.sort(Comparator.comparingLong(Ban::id));
            return out;
        });
    }

    @Override
    public NetworkRange addRange(long banId, Cidr cidr, Instant now) {
        return call("ban.addRange", () -> {
            NetworkRange range = new NetworkRange(nextId(RANGE_SEQ), banId, cidr);
            for (int attempt = 0; attempt < MAX_WATCH_RETRIES; attempt++) {
                List<Object> res = redis.execute(new SessionCallback<List<Object>>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                        RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                        ops.watch(banKey(banId));
                        if (!Boolean.TRUE.equals(ops.hasKey(banKey(banId)))) {
                            ops.unwatch();
                            throw new BanNotFoundException(banId);
                        }
                        ops.multi();
                        ops.opsForHash().putAll(rangeKey(range.id()), rangeFields(range));
                        ops.opsForSet().add(rangesKey(banId), String.valueOf(range.id()));
                        ops.opsForHash().put(banKey(banId), "updatedAt", millis(now));
                        return ops.exec();
                    }
                });
                if (res != null && !res.isEmpty()) {
                    return range;
                }
            }
            throw new IllegalStateException("ban:" + banId + " kept changing while adding a range");
        });
    }

    @Override
    public Optional<NetworkRange> findRange(long rangeId) {
        return call("ban.findRange", () -> readRange(rangeId));
    }

    @Override
    public boolean deleteRange(long rangeId) {
        return call("ban.deleteRange", () -> {
            Optional<NetworkRange> range = readRange(rangeId);
            if (range.isEmpty()) return false;
            long banId = range.get().banId();
            redis.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.multi();
                    ops.delete(rangeKey(rangeId));
                    ops.opsForSet().remove(rangesKey(banId), String.valueOf(rangeId));
                    return ops.exec();
                }
            });
            return true;
        });
    }

    @Override
    public void update(Ban ban) {
        call("ban.update", () -> {
            redis.opsForHash().putAll(banKey(ban.id()), banFields(ban));
            if (ban.expiresAt() == null) {
                redis.opsForHash().delete(banKey(ban.id()), "expiresAt");
            }
            return null;
        });
    }

    @Override
    public boolean delete(long banId) {
        return call("ban.delete", () -> {
            for (int attempt = 0; attempt < MAX_WATCH_RETRIES; attempt++) {
                Boolean deleted = redis.execute(new SessionCallback<Boolean>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> Boolean execute(RedisOperations<K, V> operations) throws DataAccessException {
                        RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                        ops.watch(List.of(banKey(banId), rangesKey(banId)));
                        if (!Boolean.TRUE.equals(ops.hasKey(banKey(banId)))) {
                            ops.unwatch();
                            return false;
                        }
                        Set<String> rangeIds = ops.opsForSet().members(rangesKey(banId));

                        // children first, then the parent
                        ops.multi();
                        if (rangeIds != null) {
                            for (String rangeId : rangeIds) {
                                ops.delete(rangeKey(Long.parseLong(rangeId)));
                            }
                        }
                        ops.delete(rangesKey(banId));
                        ops.delete(banKey(banId));
                        ops.opsForSet().remove(BAN_IDS, String.valueOf(banId));
                        List<Object> res = ops.exec();
                        return res == null || res.isEmpty() ? null : Boolean.TRUE;
                    }
                });
                if (deleted != null) {
                    return deleted;
                }
            }
            throw new IllegalStateException("ban:" + banId + " kept changing while being deleted");
        });
    }

    private Optional<Ban> read(long banId) {
        Map<Object, Object> m = redis.opsForHash().entries(banKey(banId));
        if (m == null || m.isEmpty()) return Optional.empty();

        List<NetworkRange> ranges = new ArrayList<>();
        Set<String> rangeIds = redis.opsForSet().members(rangesKey(banId));
        if (rangeIds != null) {
            for (String rangeId : rangeIds) {
                readRange(Long.parseLong(rangeId)).ifPresent(ranges::add);
            }
        }
        ranges.sort(Comparator.comparingLong(NetworkRange::id));

        return Optional.of(new Ban(
                banId,
                string(m, "title"),
                string(m, "description"),
                bool(m, "active"),
                instant(m, "expiresAt"),
                instant(m, "createdAt"),
                instant(m, "updatedAt"),
                ranges
        ));
    }

    private Optional<NetworkRange> readRange(long rangeId) {
        Map<Object, Object> m = redis.opsForHash().entries(rangeKey(rangeId));
        if (m == null || m.isEmpty()) return Optional.empty();
        return Optional.of(new NetworkRange(rangeId, number(m, "banId"), Cidr.parse(string(m, "cidr"))));
    }

    private static Map<String, String> banFields(Ban b) {
        Map<String, String> f = new HashMap<>();
        if (b.title() != null) f.put("title", b.title());
        if (b.description() != null) f.put("description", b.description());
        f.put("active", String.valueOf(b.active()));
        if (b.expiresAt() != null) f.put("expiresAt", millis(b.expiresAt()));
        f.put("createdAt", millis(b.createdAt()));
        f.put("updatedAt", millis(b.updatedAt()));
        return f;
    }

    private static Map<String, String> rangeFields(NetworkRange r) {
        Map<String, String> f = new HashMap<>();
        f.put("banId", String.valueOf(r.banId()));
        f.put("cidr", r.cidr().toString());
        return f;
    }
}
