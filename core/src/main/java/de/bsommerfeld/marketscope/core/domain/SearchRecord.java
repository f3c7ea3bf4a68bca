package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * One merger/acquisition look-up. Repeated searches for the same subject and
 * timeframe are all kept.
 *
 * @param timeframe free-form, e.g. "last 12 months"
 */
public record SearchRecord(long id, String subject, String timeframe, String payload, int dealsFound, Instant createdAt) {
}
