package com.shlokmestry.gatekeeper.bans;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.shlokmestry.gatekeeper.net.Cidr;

@Repository
@ConditionalOnProperty(name = "gatekeeper.store", havingValue = "memory")
public class InMemoryBanStore implements BanStore {

    private final AtomicLong banSeq = new AtomicLong();
    private final AtomicLong rangeSeq = new AtomicLong();
    private final Map<Long, Ban> bans = new ConcurrentHashMap<>();
    private final Map<Long, Long> banIdByRange = new ConcurrentHashMap<>();

    @Override
    public Ban create(String title, String description, boolean active, Instant expiresAt, List<Cidr> ranges,
                      Instant now) {
        long id = banSeq.incrementAndGet();
        List<NetworkRange> children = new ArrayList<>(ranges.size());
        for (Cidr cidr : ranges) {
            children.add(new NetworkRange(rangeSeq.incrementAndGet(), id, cidr));
        }
        Ban ban = new Ban(id, title, description, active, expiresAt, now, now, children);
        bans.put(id, ban);
        children.forEach(r -> banIdByRange.put(r.id(), id));
        return ban;
    }

    @Override
    public Optional<Ban> findById(long banId) {
        return Optional.ofNullable(bans.get(banId));
    }

    @Override
    public List<Ban> findAll() {
        List<Ban> all = new ArrayList<>(bans.values());
        all.sort(Comparator.comparingLong(Ban::id));
        return all;
    }

    @Override
    public NetworkRange addRange(long banId, Cidr cidr, Instant now) {
        NetworkRange range = new NetworkRange(rangeSeq.incrementAndGet(), banId, cidr);
        Ban updated = bans.computeIfPresent(banId, (id, ban) -> {
            List<NetworkRange> ranges = new ArrayList<>(ban.ranges());
            ranges.add(range);
            return ban.withRanges(ranges);
        });
        if (updated == null) {
            throw new BanNotFoundException(banId);
        }
        banIdByRange.put(range.id(), banId);
        return range;
    }

    @Override
    public Optional<NetworkRange> findRange(long rangeId) {
        Long banId = banIdByRange.get(rangeId);
        if (banId == null) return Optional.empty();
        return findById(banId).flatMap(b -> b.ranges().stream().filter(r -> r.id() == rangeId).findFirst());
    }

    @Override
    public boolean deleteRange(long rangeId) {
        Long banId = banIdByRange.remove(rangeId);
        if (banId == null) return false;
        bans.computeIfPresent(banId, (id, ban) -> ban.withRanges(
                ban.ranges().stream().filter(r -> r.id() != rangeId).toList()));
        return true;
    }

    @Override
    public void update(Ban ban) {
        bans.computeIfPresent(ban.id(), (id, old) -> ban.withRanges(old.ranges()));
    }

    @Override
    public boolean delete(long banId) {
        Ban removed = bans.remove(banId);
        if (removed == null) return false;
        removed.ranges().forEach(r -> banIdByRange.remove(r.id()));
        return true;
    }
}
