package com.agentbench.core.store;

/**
 * Unchecked wrapper for persistence failures.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
