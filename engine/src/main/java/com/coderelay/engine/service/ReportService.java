package com.coderelay.engine.service;

import com.coderelay.engine.ledger.ProposalLedger;
import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.Workspace;
import com.coderelay.engine.model.WorkspaceState;
import com.coderelay.engine.tree.VersionedTree;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class ReportService {

    private final TaskLedger       taskLedger;
    private final ProposalLedger   proposalLedger;
    private final WorkspaceService workspaceService;
    private final VersionedTree    tree;

    public ReportService(TaskLedger taskLedger,
                         ProposalLedger proposalLedger,
                         WorkspaceService workspaceService,
                         VersionedTree tree) {
        this.taskLedger       = taskLedger;
        this.proposalLedger   = proposalLedger;
        this.workspaceService = workspaceService;
        this.tree             = tree;
    }

    public ProgressReport report() {
        String head = tree.trunkHead();

        List<UUID> escalated = proposalLedger.list(ProposalStatus.APPROVED).stream()
                .filter(ChangeProposal::isEscalated)
                .map(ChangeProposal::getId)
                .toList();

        List<ProgressReport.WorkspaceLine> workspaces = workspaceService.listAll().stream()
                .map(ws -> new ProgressReport.WorkspaceLine(ws.getId(), ws.getState(), ws.getSyncedRevision(),
                        isCurrent(ws, head)))
                .toList();

        return new ProgressReport(tree.trunkBranch(), head,
                taskLedger.countByStatus(), proposalLedger.countByStatus(), escalated, workspaces);
    }

    private static boolean isCurrent(Workspace ws, String head) {
        return ws.getState() == WorkspaceState.ACTIVE && head.equals(ws.getSyncedRevision());
    }
}
