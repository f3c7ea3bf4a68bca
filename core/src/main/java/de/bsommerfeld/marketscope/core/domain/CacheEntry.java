package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * One row of the analysis cache. At most one entry exists per
 * {@code fingerprint}; rewriting the fingerprint replaces the payload and
 * resets the expiry.
 *
 * @param id          surrogate key, stable across refreshes of the same fingerprint
 * @param subject     market or topic the analysis is about, e.g. "EV Batteries"
 * @param queryKind   analysis kind, e.g. {@code global} or {@code vertical}
 * @param fingerprint digest of subject, kind and parameters
 * @param payload     the cached text
 * @param createdAt   time of the last write
 * @param expiresAt   end of validity, {@code null} for entries that never expire
 * @param source      name of the service that produced the payload
 */
public record CacheEntry(
        long id,
        String subject,
        String queryKind,
        String fingerprint,
        String payload,
        Instant createdAt,
        Instant expiresAt,
        String source) {

    /** True once {@code now} has reached the expiry. Entries without expiry never expire. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
