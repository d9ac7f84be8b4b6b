package com.shlokmestry.gatekeeper.net;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

// One binary trie per address family. Mutations hold the write lock, so all ranges of a ban
// appear or disappear together for readers.
@Component
public class CidrRangeIndex {

    private static final Logger log = LoggerFactory.getLogger(CidrRangeIndex.class);

    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Node v4Root = new Node();
    private Node v6Root = new Node();
    private final Map<Long, IndexedBan> bans = new HashMap<>();
    private int rangeCount;

    public CidrRangeIndex(Clock clock) {
        this.clock = clock;
    }

    public boolean isBanned(String address) {
        return isBanned(IpAddresses.parse(address));
    }

    public boolean isBanned(InetAddress address) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            byte[] bits = address.getAddress();
            Node node = rootFor(bits.length);
            int depth = 0;
            while (node != null) {
                if (node.owners != null && anyLive(node.owners.keySet(), now)) {
                    return true;
                }
                if (depth == bits.length * 8) {
                    break;
                }
                node = node.child(bit(bits, depth++));
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<Long> matchingBans(InetAddress address) {
        Instant now = clock.instant();
        Set<Long> out = new TreeSet<>();
        lock.readLock().lock();
        try {
            byte[] bits = address.getAddress();
            Node node = rootFor(bits.length);
            int depth = 0;
            while (node != null) {
                if (node.owners != null) {
                    for (Long banId : node.owners.keySet()) {
                        if (isLive(banId, now)) {
                            out.add(banId);
                        }
                    }
                }
                if (depth == bits.length * 8) {
                    break;
                }
                node = node.child(bit(bits, depth++));
            }
        } finally {
            lock.readLock().unlock();
        }
        return out;
    }

    public void addRange(Cidr range, long banId, Instant expiresAt) {
        lock.writeLock().lock();
        try {
            IndexedBan ban = bans.computeIfAbsent(banId, id -> new IndexedBan(expiresAt));
            ban.expiresAt = expiresAt;
            ban.ranges.add(range);
            insert(range, banId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void replaceBan(long banId, Instant expiresAt, Collection<Cidr> ranges) {
        lock.writeLock().lock();
        try {
            removeAll(banId);
            IndexedBan ban = new IndexedBan(expiresAt);
            bans.put(banId, ban);
            for (Cidr range : ranges) {
                ban.ranges.add(range);
                insert(range, banId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean removeRange(Cidr range, long banId) {
        lock.writeLock().lock();
        try {
            IndexedBan ban = bans.get(banId);
            if (ban == null || !ban.ranges.remove(range)) {
                return false;
            }
            delete(range, banId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int removeRangesForBan(long banId) {
        lock.writeLock().lock();
        try {
            return removeAll(banId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void replaceAll(Collection<BanRanges> live) {
        lock.writeLock().lock();
        try {
            v4Root = new Node();
            v6Root = new Node();
            bans.clear();
            rangeCount = 0;
            for (BanRanges b : live) {
                IndexedBan ban = new IndexedBan(b.expiresAt());
                bans.put(b.banId(), ban);
                for (Cidr range : b.ranges()) {
                    ban.ranges.add(range);
                    insert(range, b.banId());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rangeCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- write-lock helpers ---

    private int removeAll(long banId) {
        IndexedBan ban = bans.remove(banId);
        if (ban == null) {
            return 0;
        }
        for (Cidr range : ban.ranges) {
            delete(range, banId);
        }
        log.debug("index retire banId={} ranges={}", banId, ban.ranges.size());
        return ban.ranges.size();
    }

    private void insert(Cidr range, long banId) {
        byte[] bits = range.networkBytes();
        Node node = rootFor(bits.length);
        for (int depth = 0; depth < range.prefixLength(); depth++) {
            node = node.childOrCreate(bit(bits, depth));
        }
        if (node.owners == null) {
            node.owners = new HashMap<>(2);
        }
        node.owners.merge(banId, 1, Integer::sum);
        rangeCount++;
    }

    private void delete(Cidr range, long banId) {
        byte[] bits = range.networkBytes();
        Node root = rootFor(bits.length);
        List<Node> path = new ArrayList<>(range.prefixLength() + 1);
        Node node = root;
        path.add(node);
        for (int depth = 0; depth < range.prefixLength() && node != null; depth++) {
            node = node.child(bit(bits, depth));
            path.add(node);
        }
        if (node == null || node.owners == null || !node.owners.containsKey(banId)) {
            return;
        }
        if (node.owners.merge(banId, -1, Integer::sum) == 0) {
            node.owners.remove(banId);
        }
        if (node.owners.isEmpty()) {
            node.owners = null;
        }
        rangeCount--;

        // prune empty leaves back towards the root
        for (int depth = path.size() - 1; depth > 0; depth--) {
            Node n = path.get(depth);
            if (n.owners != null || n.zero != null || n.one != null) {
                break;
            }
            Node parent = path.get(depth - 1);
            if (bit(bits, depth - 1) == 0) {
                parent.zero = null;
            } else {
                parent.one = null;
            }
        }
    }

    // --- read helpers (caller holds a lock) ---

    private boolean anyLive(Set<Long> banIds, Instant now) {
        for (Long banId : banIds) {
            if (isLive(banId, now)) {
                return true;
            }
        }
        return false;
    }

    private boolean isLive(long banId, Instant now) {
        IndexedBan ban = bans.get(banId);
        return ban != null && (ban.expiresAt == null || now.isBefore(ban.expiresAt));
    }

    private Node rootFor(int byteLength) {
        return byteLength == 4 ? v4Root : v6Root;
    }

    private static int bit(byte[] bytes, int index) {
        return (bytes[index >> 3] >> (7 - (index & 7))) & 1;
    }

    private static final class Node {
        Node zero;
        Node one;
        Map<Long, Integer> owners;

        Node child(int bit) {
            return bit == 0 ? zero : one;
        }

        Node childOrCreate(int bit) {
            if (bit == 0) {
                if (zero == null) zero = new Node();
                return zero;
            }
            if (one == null) one = new Node();
            return one;
        }
    }

    private static final class IndexedBan {
        Instant expiresAt;
        final List<Cidr> ranges = new ArrayList<>();

        IndexedBan(Instant expiresAt) {
            this.expiresAt = expiresAt;
        }
    }
}
