package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * @param count      live cache entries for the subject inside the window
 * @param lastAccess newest {@code created_at} among them
 */
public record PopularSubject(String subject, int count, Instant lastAccess) {
}
