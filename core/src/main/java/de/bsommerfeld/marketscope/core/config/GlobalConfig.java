package de.bsommerfeld.marketscope.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each nested object becomes a TOML table.
 */
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("store")
    private StoreConfig store = new StoreConfig();

    @JsonProperty("research")
    private ResearchConfig research = new ResearchConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public StoreConfig getStore() {
        return store;
    }

    public ResearchConfig getResearch() {
        return research;
    }
}
