package com.shlokmestry.gatekeeper.internal;

import java.util.Set;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.gatekeeper.bans.BanService;
import com.shlokmestry.gatekeeper.net.CidrRangeIndex;
import com.shlokmestry.gatekeeper.net.IpAddresses;

@RestController
public class IndexController {

    private final CidrRangeIndex index;
    private final BanService bans;

    public IndexController(CidrRangeIndex index, BanService bans) {
        this.index = index;
        this.bans = bans;
    }

    @GetMapping("/internal/index")
    public IndexStatus status(@RequestParam(required = false) String address) {
        Set<Long> matching = address == null ? Set.of() : index.matchingBans(IpAddresses.parse(address));
        return new IndexStatus(index.size(), matching);
    }

    @PostMapping("/internal/index/rebuild")
    public RebuildResult rebuild() {
        int live = bans.rebuildIndex();
        return new RebuildResult(live, index.size());
    }

    public record IndexStatus(int ranges, Set<Long> matchingBans) {}

    public record RebuildResult(int bans, int ranges) {}
}
