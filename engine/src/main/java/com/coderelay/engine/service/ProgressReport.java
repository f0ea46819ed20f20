package com.coderelay.engine.service;

import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.TaskStatus;
import com.coderelay.engine.model.WorkspaceState;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Snapshot of overall progress: what is done, in flight and stuck. */
public record ProgressReport(
        String                      trunkBranch,
        String                      trunkHead,
        Map<TaskStatus, Long>       tasks,
        Map<ProposalStatus, Long>   proposals,
        List<UUID>                  escalatedProposals,
        List<WorkspaceLine>         workspaces
) {
    public record WorkspaceLine(String id, WorkspaceState state, String syncedRevision, boolean current) {
    }
}
