package com.shlokmestry.gatekeeper.bans;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shlokmestry.gatekeeper.net.BanRanges;
import com.shlokmestry.gatekeeper.net.Cidr;
import com.shlokmestry.gatekeeper.net.CidrRangeIndex;

@Service
public class BanService {

    private static final Logger log = LoggerFactory.getLogger(BanService.class);

    private final BanStore store;
    private final CidrRangeIndex index;
    private final Clock clock;
    private final Object writeLock = new Object();

    public BanService(BanStore store, CidrRangeIndex index, Clock clock) {
        this.store = store;
        this.index = index;
        this.clock = clock;
    }

    public Ban createBan(String title, String description, List<String> ranges, Instant expiresAt) {
        return createBan(title, description, true, ranges, expiresAt);
    }

    public Ban createBan(String title, String description, boolean active, List<String> ranges, Instant expiresAt) {
        // parse everything before the first write: one bad block rejects the whole ban
        List<Cidr> parsed = new ArrayList<>(ranges.size());
        for (String r : ranges) {
            parsed.add(Cidr.parse(r));
        }

        synchronized (writeLock) {
            Ban ban = store.create(title, description, active, expiresAt, parsed, clock.instant());
            project(ban);
            log.info("ban create banId={} title={} ranges={} active={} expiresAt={}",
                    ban.id(), ban.title(), ban.ranges().size(), ban.active(), ban.expiresAt());
            return ban;
        }
    }

    public NetworkRange addRangeToBan(long banId, String networkValue) {
        Cidr cidr = Cidr.parse(networkValue);

        synchronized (writeLock) {
            NetworkRange range = store.addRange(banId, cidr, clock.instant());
            Ban ban = getBan(banId);
            if (ban.active()) {
                index.addRange(cidr, banId, ban.expiresAt());
            }
            log.info("ban add_range banId={} rangeId={} cidr={}", banId, range.id(), cidr);
            return range;
        }
    }

    public void removeRange(long rangeId) {
        synchronized (writeLock) {
            NetworkRange range = store.findRange(rangeId)
                    .orElseThrow(() -> new RangeNotFoundException(rangeId));
            if (!store.deleteRange(rangeId)) {
                throw new RangeNotFoundException(rangeId);
            }
            index.removeRange(range.cidr(), range.banId());
            log.info("ban remove_range banId={} rangeId={} cidr={}", range.banId(), rangeId, range.cidr());
        }
    }

    public Ban updateBan(long banId, BanUpdate update) {
        synchronized (writeLock) {
            Ban updated = getBan(banId).withUpdate(update, clock.instant());
            store.update(updated);
            project(updated);
            log.info("ban update banId={} active={} expiresAt={}", banId, updated.active(), updated.expiresAt());
            return updated;
        }
    }

    public void retireBan(long banId) {
        synchronized (writeLock) {
            if (!store.delete(banId)) {
                throw new BanNotFoundException(banId);
            }
            int removed = index.removeRangesForBan(banId);
            log.info("ban retire banId={} ranges={}", banId, removed);
        }
    }

    public Ban getBan(long banId) {
        return store.findById(banId).orElseThrow(() -> new BanNotFoundException(banId));
    }

    public List<Ban> listBans() {
        return store.findAll();
    }

    public int rebuildIndex() {
        synchronized (writeLock) {
            List<BanRanges> live = new ArrayList<>();
            for (Ban ban : store.findAll()) {
                if (ban.active()) {
                    live.add(toRanges(ban));
                }
            }
            index.replaceAll(live);
            log.info("index rebuild bans={} ranges={}", live.size(), index.size());
            return live.size();
        }
    }

    private void project(Ban ban) {
        if (ban.active()) {
            BanRanges r = toRanges(ban);
            index.replaceBan(r.banId(), r.expiresAt(), r.ranges());
        } else {
            index.removeRangesForBan(ban.id());
        }
    }

    private static BanRanges toRanges(Ban ban) {
        return new BanRanges(ban.id(), ban.expiresAt(), ban.ranges().stream().map(NetworkRange::cidr).toList());
    }
}
