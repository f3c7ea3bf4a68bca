package de.bsommerfeld.marketscope.db;

/**
 * The database file could not be opened, read or written. Not recoverable
 * inside the store.
 */
public class StorageUnavailableException extends StoreException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
