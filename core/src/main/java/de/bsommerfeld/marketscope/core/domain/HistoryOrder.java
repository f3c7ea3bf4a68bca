package de.bsommerfeld.marketscope.core.domain;

/**
 * Order of an interaction history. Display lists want the latest question on
 * top, session replay wants the original order.
 */
public enum HistoryOrder {
    NEWEST_FIRST,
    OLDEST_FIRST
}
