package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * A cache hit as returned to callers.
 *
 * @param expiresAt {@code null} when the entry never expires
 */
public record CachedAnalysis(String payload, String source, Instant cachedAt, Instant expiresAt) {
}
