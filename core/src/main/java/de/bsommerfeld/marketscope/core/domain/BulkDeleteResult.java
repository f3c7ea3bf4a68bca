package de.bsommerfeld.marketscope.core.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record BulkDeleteResult(DeleteScope scope, Map<StoreTable, Integer> deleted) {

    public BulkDeleteResult {
        deleted = Collections.unmodifiableMap(new EnumMap<>(deleted));
    }

    public int deleted(StoreTable table) {
        return deleted.getOrDefault(table, 0);
    }

    public int total() {
        return deleted.values().stream().mapToInt(Integer::intValue).sum();
    }
}
