package de.bsommerfeld.marketscope.core.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a bulk delete wipes. {@link #DOCUMENTS} always takes the documents'
 * interactions with it.
 */
public enum DeleteScope {

    CACHE(EnumSet.of(StoreTable.CACHE_ENTRIES)),
    DOCUMENTS(EnumSet.of(StoreTable.INTERACTIONS, StoreTable.DOCUMENTS)),
    SEARCHES(EnumSet.of(StoreTable.SEARCHES)),
    TELEMETRY(EnumSet.of(StoreTable.TELEMETRY_EVENTS)),
    EVERYTHING(EnumSet.allOf(StoreTable.class));

    private final Set<StoreTable> tables;

    DeleteScope(Set<StoreTable> tables) {
        this.tables = tables;
    }

    /** Affected tables in {@link StoreTable} declaration order. */
    public Set<StoreTable> tables() {
        return EnumSet.copyOf(tables);
    }
}
