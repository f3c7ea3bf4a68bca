package de.bsommerfeld.marketscope.db;

/**
 * A write referenced a parent row that does not exist, e.g. an interaction
 * for a deleted document.
 */
public class NotFoundException extends StoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
