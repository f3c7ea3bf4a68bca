package de.bsommerfeld.marketscope.core.domain;

/**
 * Outcome of a full maintenance run.
 *
 * @param bytesReclaimed file size before compaction minus size after, never negative
 */
public record CleanupReport(int expiredCacheEntries, int telemetryEventsPurged, long bytesReclaimed) {
}
