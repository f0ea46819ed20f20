package com.coderelay.engine.api;

import com.coderelay.engine.api.dto.DiffResponse;
import com.coderelay.engine.api.dto.MergeOutcomeResponse;
import com.coderelay.engine.api.dto.ProposalResponse;
import com.coderelay.engine.api.dto.ResubmitRequest;
import com.coderelay.engine.api.dto.ReviewRequest;
import com.coderelay.engine.api.dto.SubmitProposalRequest;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.service.MergeCoordinator;
import com.coderelay.engine.service.ProposalService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for change proposals.
 *
 * POST /proposals                 — submit the worker's task branch for review
 * GET  /proposals?status=         — list proposals
 * GET  /proposals/{id}            — proposal with comments and conflicts
 * GET  /proposals/{id}/diff       — changed files, for review
 * POST /proposals/{id}/approve    — approve (merge follows asynchronously)
 * POST /proposals/{id}/reject     — request changes
 * POST /proposals/{id}/comments   — add a plain review comment
 * POST /proposals/{id}/resubmit   — back to review after a rejection or conflict
 * POST /proposals/{id}/retry      — retry an escalated merge
 */
@RestController
@RequestMapping("/proposals")
public class ProposalController {

    private final ProposalService  proposalService;
    private final MergeCoordinator mergeCoordinator;

    public ProposalController(ProposalService proposalService, MergeCoordinator mergeCoordinator) {
        this.proposalService  = proposalService;
        this.mergeCoordinator = mergeCoordinator;
    }

    @PostMapping
    public ResponseEntity<ProposalResponse> submit(@RequestBody SubmitProposalRequest req) {
        ChangeProposal proposal = proposalService.submit(
                req.workspaceId(), req.taskId(), req.title(), req.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalResponse.from(proposal));
    }

    @GetMapping
    public List<ProposalResponse> list(@RequestParam(required = false) ProposalStatus status) {
        return proposalService.list(status).stream().map(ProposalResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ProposalResponse get(@PathVariable UUID id) {
        return ProposalResponse.from(proposalService.get(id));
    }

    @GetMapping("/{id}/diff")
    public DiffResponse diff(@PathVariable UUID id) {
        return DiffResponse.from(proposalService.diff(id));
    }

    @PostMapping("/{id}/approve")
    public ProposalResponse approve(@PathVariable UUID id, @RequestBody ReviewRequest req) {
        return ProposalResponse.from(proposalService.approve(id, req.reviewer(), req.body()));
    }

    @PostMapping("/{id}/reject")
    public ProposalResponse reject(@PathVariable UUID id, @RequestBody ReviewRequest req) {
        return ProposalResponse.from(proposalService.reject(id, req.reviewer(), req.body()));
    }

    @PostMapping("/{id}/comments")
    public ProposalResponse comment(@PathVariable UUID id, @RequestBody ReviewRequest req) {
        return ProposalResponse.from(proposalService.comment(id, req.reviewer(), req.body()));
    }

    @PostMapping("/{id}/resubmit")
    public ProposalResponse resubmit(@PathVariable UUID id,
                                     @RequestBody(required = false) ResubmitRequest req) {
        return ProposalResponse.from(proposalService.resubmit(id, req == null ? null : req.note()));
    }

    @PostMapping("/{id}/retry")
    public MergeOutcomeResponse retry(@PathVariable UUID id) {
        return MergeOutcomeResponse.from(mergeCoordinator.retryEscalated(id));
    }
}
