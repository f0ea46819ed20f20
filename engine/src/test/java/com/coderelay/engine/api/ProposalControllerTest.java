package com.coderelay.engine.api;

import com.coderelay.engine.TestEntities;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.ReviewComment;
import com.coderelay.engine.service.MergeCoordinator;
import com.coderelay.engine.service.MergeOutcome;
import com.coderelay.engine.service.ProposalService;
import com.coderelay.engine.tree.PatchSet;
import com.coderelay.engine.tree.TreeIOException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProposalController.class)
class ProposalControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean ProposalService  proposalService;
    @MockitoBean MergeCoordinator mergeCoordinator;

    @Test
    void submit_returns201WithBranches() throws Exception {
        UUID taskId = UUID.randomUUID();
        ChangeProposal p = TestEntities.proposal(taskId, "worker-a", ProposalStatus.OPEN);
        when(proposalService.submit("worker-a", taskId, "Greeting", null)).thenReturn(p);

        mockMvc.perform(post("/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workspaceId":"worker-a","taskId":"%s","title":"Greeting"}
                                """.formatted(taskId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.sourceBranch").value(p.getSourceBranch()))
                .andExpect(jsonPath("$.targetBranch").value("main"));
    }

    @Test
    void get_conflictedProposal_showsPathsAndSystemComment() throws Exception {
        ChangeProposal p = TestEntities.proposal(UUID.randomUUID(), "worker-c", ProposalStatus.OPEN);
        p.setConflictingPaths(List.of("foo.py"));
        p.addComment(ReviewComment.system("Merge into main conflicts on foo.py."));
        when(proposalService.get(p.getId())).thenReturn(p);

        mockMvc.perform(get("/proposals/{id}", p.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conflictingPaths[0]").value("foo.py"))
                .andExpect(jsonPath("$.comments[0].verdict").value("SYSTEM"));
    }

    @Test
    void approve_withoutReviewer_usesDefaultReviewer() throws Exception {
        ChangeProposal p = TestEntities.proposal(UUID.randomUUID(), "worker-a", ProposalStatus.APPROVED);
        when(proposalService.approve(p.getId(), "reviewer", "LGTM")).thenReturn(p);

        mockMvc.perform(post("/proposals/{id}/approve", p.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"LGTM\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));
    }

    @Test
    void approve_alreadyMerged_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(proposalService.approve(any(), any(), any()))
                .thenThrow(new StaleStateException(id.toString(), "Proposal is MERGED, expected OPEN"));

        mockMvc.perform(post("/proposals/{id}/approve", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewer\":\"alice\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Proposal is MERGED, expected OPEN"));
    }

    @Test
    void resubmit_withoutBody_passesNoNote() throws Exception {
        ChangeProposal p = TestEntities.proposal(UUID.randomUUID(), "worker-c", ProposalStatus.OPEN);
        when(proposalService.resubmit(any(), isNull())).thenReturn(p);

        mockMvc.perform(post("/proposals/{id}/resubmit", p.getId()))
                .andExpect(status().isOk());
    }

    @Test
    void diff_listsTouchedPaths() throws Exception {
        UUID id = UUID.randomUUID();
        when(proposalService.diff(id)).thenReturn(new PatchSet("base", "head",
                List.of(new PatchSet.FileChange(PatchSet.ChangeType.MODIFY, "foo.py", "foo.py"))));

        mockMvc.perform(get("/proposals/{id}/diff", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paths[0]").value("foo.py"))
                .andExpect(jsonPath("$.changes[0].type").value("MODIFY"));
    }

    @Test
    void retry_backendStillDown_returns503() throws Exception {
        UUID id = UUID.randomUUID();
        when(mergeCoordinator.retryEscalated(id)).thenThrow(new TreeIOException("trunk unreachable"));

        mockMvc.perform(post("/proposals/{id}/retry", id))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void retry_merged_returnsOutcome() throws Exception {
        UUID id = UUID.randomUUID();
        when(mergeCoordinator.retryEscalated(id)).thenReturn(MergeOutcome.merged(id, "abc123"));

        mockMvc.perform(post("/proposals/{id}/retry", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("MERGED"))
                .andExpect(jsonPath("$.revision").value("abc123"));
    }
}
