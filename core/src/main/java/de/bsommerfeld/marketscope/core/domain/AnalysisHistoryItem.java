package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * A (subject, kind) pair with live cached analyses, for history browsing.
 * {@code entryCount} is greater than one when the same kind was cached under
 * different parameter sets.
 */
public record AnalysisHistoryItem(String subject, String queryKind, Instant lastCachedAt, int entryCount) {
}
