package com.shlokmestry.gatekeeper.access;

import java.net.InetAddress;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shlokmestry.gatekeeper.keys.KeyValidator;
import com.shlokmestry.gatekeeper.net.CidrRangeIndex;
import com.shlokmestry.gatekeeper.net.IpAddresses;
import com.shlokmestry.gatekeeper.observability.GatekeeperMetrics;
import com.shlokmestry.gatekeeper.store.StoreUnavailableException;
import com.shlokmestry.gatekeeper.usage.RequestAggregator;
import com.shlokmestry.gatekeeper.usage.UsageEvent;

@Service
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private final KeyValidator keys;
    private final CidrRangeIndex bans;
    private final RequestAggregator aggregator;
    private final GatekeeperMetrics metrics;

    public AccessControlService(KeyValidator keys, CidrRangeIndex bans, RequestAggregator aggregator,
                                GatekeeperMetrics metrics) {
        this.keys = keys;
        this.bans = bans;
        this.aggregator = aggregator;
        this.metrics = metrics;
    }

    public AuthorizationDecision authorizeRequest(String token, String sourceAddress) {
        InetAddress address = IpAddresses.parse(sourceAddress);

        boolean banned = bans.isBanned(address);
        Optional<Long> keyId;
        try {
            keyId = keys.validate(token);
        } catch (StoreUnavailableException e) {
            metrics.undetermined();
            throw new KeyUndeterminedException(banned, e);
        }

        AuthorizationDecision decision = new AuthorizationDecision(keyId.isPresent(), keyId.orElse(null), banned);
        metrics.decision(decision.authenticated(), decision.banned());
        log.debug("authorize address={} authenticated={} keyId={} banned={}",
                address.getHostAddress(), decision.authenticated(), decision.keyId(), decision.banned());
        return decision;
    }

    public void recordUsage(Long keyId, String sourceAddress, String endpointName, Instant timestampUtc,
                            int statusCode, long elapsedMillis, long responseBytes) {
        InetAddress address = IpAddresses.parse(sourceAddress);
        aggregator.recordEvent(new UsageEvent(
                keyId, address, endpointName, timestampUtc, statusCode, elapsedMillis, responseBytes));
    }
}
