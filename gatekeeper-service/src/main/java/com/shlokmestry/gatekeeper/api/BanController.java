package com.shlokmestry.gatekeeper.api;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.gatekeeper.bans.BanService;
import com.shlokmestry.gatekeeper.bans.BanUpdate;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/bans")
public class BanController {

    private final BanService bans;

    public BanController(BanService bans) {
        this.bans = bans;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BanResponse create(@Valid @RequestBody CreateBanRequest req) {
        return BanResponse.from(bans.createBan(
                req.title(),
                req.description(),
                req.active() == null || req.active(),
                req.ranges() == null ? List.of() : req.ranges(),
                req.expiresAt()
        ));
    }

    @GetMapping
    public List<BanResponse> list() {
        return bans.listBans().stream().map(BanResponse::from).toList();
    }

    @GetMapping("/{banId}")
    public BanResponse get(@PathVariable long banId) {
        return BanResponse.from(bans.getBan(banId));
    }

    @PatchMapping("/{banId}")
    public BanResponse update(@PathVariable long banId, @RequestBody UpdateBanRequest req) {
        return BanResponse.from(bans.updateBan(banId,
                new BanUpdate(req.title(), req.description(), req.active(), req.expiresAt(),
                        Boolean.TRUE.equals(req.clearExpiry()))));
    }

    @PostMapping("/{banId}/ranges")
    @ResponseStatus(HttpStatus.CREATED)
    public BanResponse.RangeResponse addRange(@PathVariable long banId, @Valid @RequestBody AddRangeRequest req) {
        return BanResponse.RangeResponse.from(bans.addRangeToBan(banId, req.cidr()));
    }

    @DeleteMapping("/ranges/{rangeId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeRange(@PathVariable long rangeId) {
        bans.removeRange(rangeId);
    }

    @DeleteMapping("/{banId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void retire(@PathVariable long banId) {
        bans.retireBan(banId);
    }
}
