package com.shlokmestry.gatekeeper.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.shlokmestry.gatekeeper.bans.BanService;
import com.shlokmestry.gatekeeper.net.CidrRangeIndex;
import com.shlokmestry.gatekeeper.observability.GatekeeperMetrics;
import com.shlokmestry.gatekeeper.store.StoreUnavailableException;

@Component
public class IndexBootstrap {

    private static final Logger log = LoggerFactory.getLogger(IndexBootstrap.class);

    private final BanService bans;
    private final GatekeeperProperties props;

    public IndexBootstrap(BanService bans, CidrRangeIndex index, GatekeeperMetrics metrics,
                          GatekeeperProperties props) {
        this.bans = bans;
        this.props = props;
        metrics.indexSize(index::size);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rebuild() {
        if (!props.getIndex().isRebuildOnStartup()) {
            return;
        }
        try {
            bans.rebuildIndex();
        } catch (StoreUnavailableException e) {
            // stays empty until POST /internal/index/rebuild succeeds
            log.error("index rebuild failed at startup; ban checks match nothing until rebuilt", e);
        }
    }
}
