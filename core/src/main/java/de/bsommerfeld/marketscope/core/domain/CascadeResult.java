package de.bsommerfeld.marketscope.core.domain;

/** Rows removed by a cascading document delete. */
public record CascadeResult(int documentsDeleted, int interactionsDeleted) {

    public static final CascadeResult NONE = new CascadeResult(0, 0);
}
