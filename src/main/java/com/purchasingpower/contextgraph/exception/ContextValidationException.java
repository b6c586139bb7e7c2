package com.purchasingpower.contextgraph.exception;

import lombok.Getter;

/**
 * Raised when an edge definition or a context payload does not have the
 * shape its operation requires.
 */
@Getter
public class ContextValidationException extends RuntimeException {

    private final String field;

    public ContextValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
