package org.gudu0.starboardbot.remote;

/** The remote message or channel no longer exists. */
public class RemoteNotFoundException extends RuntimeException {
    public RemoteNotFoundException(String message) {
        super(message);
    }

    public RemoteNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
