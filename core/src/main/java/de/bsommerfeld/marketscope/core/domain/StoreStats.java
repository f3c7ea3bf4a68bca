package de.bsommerfeld.marketscope.core.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Row counts per table and the size of the database file.
 */
public record StoreStats(Map<StoreTable, Long> rowCounts, long sizeBytes) {

    public StoreStats {
        rowCounts = Collections.unmodifiableMap(new EnumMap<>(rowCounts));
    }

    public long rows(StoreTable table) {
        return rowCounts.getOrDefault(table, 0L);
    }

    public long totalRows() {
        return rowCounts.values().stream().mapToLong(Long::longValue).sum();
    }

    public double sizeMegabytes() {
        return sizeBytes / (1024.0 * 1024.0);
    }
}
