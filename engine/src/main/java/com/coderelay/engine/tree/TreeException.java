package com.coderelay.engine.tree;

/**
 * Base type for failures reported by the versioned tree.
 */
public abstract class TreeException extends RuntimeException {

    protected TreeException(String message) {
        super(message);
    }

    protected TreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
