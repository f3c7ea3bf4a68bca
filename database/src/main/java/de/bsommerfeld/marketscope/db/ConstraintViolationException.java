package de.bsommerfeld.marketscope.db;

/** Duplicate unique key on a strict insert. */
public class ConstraintViolationException extends StoreException {

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
