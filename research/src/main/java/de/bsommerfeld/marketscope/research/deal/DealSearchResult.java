package de.bsommerfeld.marketscope.research.deal;

/**
 * @param searchId id of the stored search history row
 */
public record DealSearchResult(long searchId, String payload, int dealsFound) {
}
