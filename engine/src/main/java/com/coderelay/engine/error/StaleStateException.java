package com.coderelay.engine.error;

/**
 * A compare-and-swap found the record in a different state than the caller
 * expected: someone else changed it between the read and the write.
 *
 * This is a normal outcome under contention (two workers racing for the same
 * task, a reviewer and the merge coordinator touching the same proposal).
 * Callers re-read and pick another target; it is never reported as a failure.
 */
public class StaleStateException extends RuntimeException {

    private final String recordId;

    public StaleStateException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public StaleStateException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    public String getRecordId() { return recordId; }
}
