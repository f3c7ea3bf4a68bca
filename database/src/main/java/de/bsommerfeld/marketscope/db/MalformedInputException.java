package de.bsommerfeld.marketscope.db;

public class MalformedInputException extends StoreException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
