package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * Row of the document session browser.
 *
 * @param lastQuestionAt {@code null} when no question was asked yet
 */
public record DocumentSummary(
        long id,
        String displayName,
        int pageCount,
        int chunkCount,
        Instant processedAt,
        int interactionCount,
        Instant lastQuestionAt) {
}
