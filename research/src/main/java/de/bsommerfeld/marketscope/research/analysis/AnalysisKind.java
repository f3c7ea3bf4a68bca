package de.bsommerfeld.marketscope.research.analysis;

import java.util.Arrays;
import java.util.Optional;

/**
 * The analyses the dashboard can generate for a market. {@link #key()} is
 * what the cache stores as {@code query_kind}.
 */
public enum AnalysisKind {

    GLOBAL("global"),
    VERTICAL("vertical"),
    HORIZONTAL("horizontal"),
    METRICS("metrics"),
    TOP_COMPANIES("top_companies"),
    MERGERS("mergers"),
    WEB_INSIGHTS("web_insights");

    private final String key;

    AnalysisKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<AnalysisKind> fromKey(String key) {
        return Arrays.stream(values()).filter(kind -> kind.key.equals(key)).findFirst();
    }
}
