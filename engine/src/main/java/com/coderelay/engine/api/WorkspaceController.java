package com.coderelay.engine.api;

import com.coderelay.engine.api.dto.BranchRequest;
import com.coderelay.engine.api.dto.BranchResponse;
import com.coderelay.engine.api.dto.CommitRequest;
import com.coderelay.engine.api.dto.CommitResponse;
import com.coderelay.engine.api.dto.IntegrateRequest;
import com.coderelay.engine.api.dto.MergeResultResponse;
import com.coderelay.engine.api.dto.SyncResponse;
import com.coderelay.engine.api.dto.WorkerRequest;
import com.coderelay.engine.api.dto.WorkspaceResponse;
import com.coderelay.engine.service.SyncOutcome;
import com.coderelay.engine.service.WorkspaceService;
import com.coderelay.engine.tree.MergeResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for worker workspaces.
 *
 * POST   /workspaces                  — register a worker (clones trunk)
 * GET    /workspaces                  — all workspaces
 * GET    /workspaces/{id}             — one workspace
 * POST   /workspaces/{id}/branches    — start (or switch to) a task branch
 * POST   /workspaces/{id}/commits     — commit changes on the task branch
 * POST   /workspaces/{id}/sync        — fast-forward to the trunk head now
 * POST   /workspaces/{id}/integrate   — merge trunk into the task branch
 * POST   /workspaces/{id}/recreate    — throw the clone away and clone again
 * DELETE /workspaces/{id}             — remove the workspace
 */
@RestController
@RequestMapping("/workspaces")
public class WorkspaceController {

    private final WorkspaceService workspaceService;

    public WorkspaceController(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    @PostMapping
    public ResponseEntity<WorkspaceResponse> register(@RequestBody WorkerRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(WorkspaceResponse.from(workspaceService.register(req.workerId())));
    }

    @GetMapping
    public List<WorkspaceResponse> list() {
        return workspaceService.listAll().stream().map(WorkspaceResponse::from).toList();
    }

    @GetMapping("/{id}")
    public WorkspaceResponse get(@PathVariable String id) {
        return WorkspaceResponse.from(workspaceService.get(id));
    }

    @PostMapping("/{id}/branches")
    public ResponseEntity<BranchResponse> startTask(@PathVariable String id, @RequestBody BranchRequest req) {
        String branch = workspaceService.startTask(id, req.taskId());
        return ResponseEntity.status(HttpStatus.CREATED).body(new BranchResponse(id, req.taskId(), branch));
    }

    @PostMapping("/{id}/commits")
    public ResponseEntity<CommitResponse> commit(@PathVariable String id, @RequestBody CommitRequest req) {
        String commitId = workspaceService.commit(id, req.taskId(), req.changes(), req.message());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CommitResponse(WorkspaceService.branchFor(req.taskId(), id), commitId));
    }

    @PostMapping("/{id}/sync")
    public SyncResponse sync(@PathVariable String id) {
        SyncOutcome outcome = workspaceService.synchronize(id);
        return new SyncResponse(id, outcome.name(), workspaceService.get(id).getSyncedRevision());
    }

    /**
     * Merge the latest trunk into the worker's task branch.
     *
     * HTTP 200 — branch now contains trunk
     * HTTP 422 — some conflicting paths have no resolution; branch unchanged
     */
    @PostMapping("/{id}/integrate")
    public ResponseEntity<MergeResultResponse> integrate(@PathVariable String id, @RequestBody IntegrateRequest req) {
        MergeResult result = workspaceService.integrateTrunk(id, req.taskId(), req.resolutions());
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(MergeResultResponse.from(result));
    }

    @PostMapping("/{id}/recreate")
    public WorkspaceResponse recreate(@PathVariable String id) {
        return WorkspaceResponse.from(workspaceService.recreate(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable String id) {
        workspaceService.remove(id);
        return ResponseEntity.noContent().build();
    }
}
