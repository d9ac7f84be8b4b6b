package com.shlokmestry.gatekeeper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gatekeeper")
public class GatekeeperProperties {

    /** Backing store: "redis" or "memory". */
    private String store = "redis";
    /** When the store cannot answer an authorization check, let the request through instead of answering 503. */
    private boolean failOpen = false;
    private final Index index = new Index();

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public boolean isFailOpen() { return failOpen; }
    public void setFailOpen(boolean failOpen) { this.failOpen = failOpen; }
    public Index getIndex() { return index; }

    public static class Index {
        /** Load the ban index from the store once the application is ready. */
        private boolean rebuildOnStartup = true;

        public boolean isRebuildOnStartup() { return rebuildOnStartup; }
        public void setRebuildOnStartup(boolean rebuildOnStartup) { this.rebuildOnStartup = rebuildOnStartup; }
    }
}
