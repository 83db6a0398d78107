package org.gudu0.starboardbot.remote;

/** The bot lacks a permission needed for a remote action. */
public class PermissionDeniedException extends RuntimeException {
    private final String permission;

    public PermissionDeniedException(String permission, String message) {
        super(message);
        this.permission = permission;
    }

    public PermissionDeniedException(String permission, String message, Throwable cause) {
        super(message, cause);
        this.permission = permission;
    }

    /** Human readable permission name, e.g. "Send Messages". */
    public String getPermission() {
        return permission;
    }
}
