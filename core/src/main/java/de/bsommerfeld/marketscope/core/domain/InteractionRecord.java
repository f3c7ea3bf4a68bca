package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * A question asked against a document and the answer it got.
 *
 * @param costEstimate USD, fixed at write time from the token estimates
 */
public record InteractionRecord(
        long id,
        long documentId,
        String question,
        String answer,
        long queryTokens,
        long responseTokens,
        double costEstimate,
        Instant createdAt) {
}
