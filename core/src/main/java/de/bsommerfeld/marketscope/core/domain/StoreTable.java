package de.bsommerfeld.marketscope.core.domain;

/**
 * The five tables of the research store, in an order that is safe for
 * deletion (children before parents).
 */
public enum StoreTable {

    CACHE_ENTRIES("cache_entries"),
    INTERACTIONS("interactions"),
    DOCUMENTS("documents"),
    SEARCHES("searches"),
    TELEMETRY_EVENTS("telemetry_events");

    private final String tableName;

    StoreTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
