package de.bsommerfeld.marketscope.core.domain;

import java.util.Locale;

/**
 * Processing state of an ingested document. Only {@link #PROCESSED}
 * documents take part in deduplication and session browsing.
 */
public enum DocumentStatus {

    PROCESSED,
    FAILED,
    ARCHIVED;

    /** Column value as persisted, e.g. {@code processed}. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DocumentStatus fromDbValue(String value) {
        return DocumentStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
