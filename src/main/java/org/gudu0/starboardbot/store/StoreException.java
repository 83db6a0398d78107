package org.gudu0.starboardbot.store;

/** Integrity or persistence failure in the starboard store. */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
