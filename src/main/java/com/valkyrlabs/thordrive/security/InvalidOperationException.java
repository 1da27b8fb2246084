package com.valkyrlabs.thordrive.security;

/**
 * Structurally invalid request, independent of who is asking: moving a folder
 * into itself or below one of its own descendants, or re-creating an existing
 * user.
 */
public class InvalidOperationException extends RuntimeException {

    private static final long serialVersionUID = 3185523409316580861L;

    public InvalidOperationException(String message) {
        super(message);
    }

    public InvalidOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
