package com.coderelay.engine.tree;

/**
 * Thrown when the git backend fails for reasons unrelated to the content
 * being merged (I/O errors, lock files, a ref moved underneath us).
 *
 * Treated as transient: callers retry it through RetryPolicy and escalate
 * only once the retry budget is spent.
 */
public class TreeIOException extends TreeException {

    public TreeIOException(String message) {
        super(message);
    }

    public TreeIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
