package de.bsommerfeld.marketscope.research.deal;

/**
 * Produces a merger/acquisition table for a market, usually as a markdown
 * table with one deal per row.
 */
@FunctionalInterface
public interface DealSearchProvider {

    String findDeals(String subject, String timeframe);
}
