package com.purchasingpower.contextgraph.exception;

/**
 * Wraps failures of the persistent graph store.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
