package de.bsommerfeld.marketscope.db;

/**
 * Base of every failure raised by the research store. Unchecked: callers
 * decide where to handle storage problems, the store never retries.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
