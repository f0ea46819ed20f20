package com.coderelay.engine.api;

import com.coderelay.engine.api.dto.CreateTaskRequest;
import com.coderelay.engine.api.dto.TaskResponse;
import com.coderelay.engine.api.dto.WorkerRequest;
import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.Task;
import com.coderelay.engine.model.TaskStatus;
import com.coderelay.engine.service.ClaimCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the task ledger.
 *
 * POST /tasks                — create a task (planner side)
 * GET  /tasks?status=        — list tasks, OPEN by default
 * GET  /tasks/{id}           — one task
 * POST /tasks/claim          — claim the next task for a worker (204 if none)
 * POST /tasks/{id}/release   — give a task back
 * POST /tasks/{id}/lease     — keep a claim alive
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskLedger       taskLedger;
    private final ClaimCoordinator claimCoordinator;

    public TaskController(TaskLedger taskLedger, ClaimCoordinator claimCoordinator) {
        this.taskLedger       = taskLedger;
        this.claimCoordinator = claimCoordinator;
    }

    @PostMapping
    public ResponseEntity<TaskResponse> create(@RequestBody CreateTaskRequest req) {
        Task task = taskLedger.createTask(req.title(), req.description(), req.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    @GetMapping
    public List<TaskResponse> list(@RequestParam(required = false) TaskStatus status) {
        List<Task> tasks = status == null ? taskLedger.listOpenTasks() : taskLedger.listByStatus(status);
        return tasks.stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/{id}")
    public TaskResponse get(@PathVariable UUID id) {
        return TaskResponse.from(taskLedger.getTask(id));
    }

    /**
     * Claim the next task for a worker.
     *
     * HTTP 200 — task claimed (or the worker's unfinished task resumed)
     * HTTP 204 — nothing claimable right now; poll again later
     */
    @PostMapping("/claim")
    public ResponseEntity<TaskResponse> claim(@RequestBody WorkerRequest req) {
        return claimCoordinator.claimNext(req.workerId())
                .map(task -> ResponseEntity.ok(TaskResponse.from(task)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/release")
    public TaskResponse release(@PathVariable UUID id, @RequestBody WorkerRequest req) {
        return TaskResponse.from(claimCoordinator.release(id, req.workerId()));
    }

    @PostMapping("/{id}/lease")
    public TaskResponse renewLease(@PathVariable UUID id, @RequestBody WorkerRequest req) {
        return TaskResponse.from(claimCoordinator.renewLease(id, req.workerId()));
    }
}
