package com.valkyrlabs.thordrive.store;

import org.springframework.dao.NonTransientDataAccessException;

/**
 * Internal persistence failure: a write against a row that vanished, or
 * hierarchy data that violates the tree invariants. Never retried by the core.
 */
public class StoreException extends NonTransientDataAccessException {

    private static final long serialVersionUID = 4412907716352310471L;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
