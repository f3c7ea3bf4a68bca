package de.bsommerfeld.marketscope.research.analysis;

/**
 * An analysis together with where it came from.
 */
public record AnalysisResult(String payload, Origin origin) {

    public enum Origin {
        /** Served from the persistent cache. */
        CACHE,
        /** Produced by this call's provider invocation. */
        COMPUTED,
        /** Produced by a concurrent call for the same key and shared. */
        SHARED
    }

    public boolean fromCache() {
        return origin == Origin.CACHE;
    }
}
