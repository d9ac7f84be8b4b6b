package com.shlokmestry.gatekeeper.bans;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.shlokmestry.gatekeeper.net.Cidr;

public interface BanStore {

    Ban create(String title, String description, boolean active, Instant expiresAt, List<Cidr> ranges, Instant now);

    Optional<Ban> findById(long banId);

    List<Ban> findAll();

    NetworkRange addRange(long banId, Cidr cidr, Instant now);

    Optional<NetworkRange> findRange(long rangeId);

    boolean deleteRange(long rangeId);

    void update(Ban ban);

    // ban and all of its ranges as one unit
    boolean delete(long banId);
}
