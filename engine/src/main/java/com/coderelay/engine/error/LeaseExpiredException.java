package com.coderelay.engine.error;

import java.util.UUID;

/**
 * The worker no longer holds the claim on a task: the lease ran out and the
 * task went back to OPEN (or someone else claimed it since).
 */
public class LeaseExpiredException extends RuntimeException {

    private final UUID   taskId;
    private final String workerId;

    public LeaseExpiredException(UUID taskId, String workerId) {
        super("Worker '" + workerId + "' no longer holds the claim on task " + taskId);
        this.taskId   = taskId;
        this.workerId = workerId;
    }

    public UUID   getTaskId()   { return taskId; }
    public String getWorkerId() { return workerId; }
}
