package com.braindump.orchestrator.api;

import com.braindump.orchestrator.TestEntities;
import com.braindump.orchestrator.error.GitException;
import com.braindump.orchestrator.error.WorkflowException;
import com.braindump.orchestrator.model.*;
import com.braindump.orchestrator.service.SessionAuditor;
import com.braindump.orchestrator.service.WorkflowService;
import com.braindump.orchestrator.service.result.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web slice for WorkflowController: status mapping of workflow errors and the
 * session bookkeeping wrapped around each call.
 */
@WebMvcTest(WorkflowController.class)
class WorkflowControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean WorkflowService workflowService;
    @MockitoBean SessionAuditor  sessionAuditor;

    // ------------------------------------------------------------------
    // POST /tickets/{id}/start
    // ------------------------------------------------------------------

    @Test
    void startWork_opensSessionAndReturnsBranch() throws Exception {
        Ticket ticket = ticketIn(TicketStatus.IN_PROGRESS);
        ticket.setBranchName("feature/12345678-login");
        when(workflowService.startWork(ticket.getId())).thenReturn(startResult(ticket, List.of()));
        ConversationSession session = TestEntities.withId(
                new ConversationSession(ticket.getId(), ticket.getProject().getId(), "vscode"), UUID.randomUUID());
        when(sessionAuditor.startSession(ticket.getId(), "vscode")).thenReturn(session);

        mockMvc.perform(post("/tickets/{id}/start", ticket.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"environment":"vscode"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.work.ticket.status").value("in_progress"))
                .andExpect(jsonPath("$.work.branchName").value("feature/12345678-login"))
                .andExpect(jsonPath("$.work.branchCreated").value(true))
                .andExpect(jsonPath("$.sessionId").value(session.getId().toString()))
                .andExpect(jsonPath("$.warnings").isEmpty());
    }

    @Test
    void startWork_sessionFailure_isOnlyAWarning() throws Exception {
        Ticket ticket = ticketIn(TicketStatus.IN_PROGRESS);
        when(workflowService.startWork(ticket.getId()))
                .thenReturn(startResult(ticket, List.of("Could not record the working directory")));
        when(sessionAuditor.startSession(eq(ticket.getId()), any()))
                .thenThrow(new IllegalStateException("database unavailable"));

        mockMvc.perform(post("/tickets/{id}/start", ticket.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").doesNotExist())
                .andExpect(jsonPath("$.warnings.length()").value(2))
                .andExpect(jsonPath("$.warnings[1]").value(
                        "Conversation session could not be started: database unavailable"));
    }

    @Test
    void startWork_unknownTicket_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.startWork(id)).thenThrow(WorkflowException.ticketNotFound(id));

        mockMvc.perform(post("/tickets/{id}/start", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TICKET_NOT_FOUND"))
                .andExpect(jsonPath("$.details.ticketId").value(id.toString()));
        verifyNoInteractions(sessionAuditor);
    }

    @Test
    void startWork_wrongState_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.startWork(id)).thenThrow(
                WorkflowException.invalidState("ticket", "ai_review", "backlog or ready", "start work"));

        mockMvc.perform(post("/tickets/{id}/start", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"))
                .andExpect(jsonPath("$.details.currentState").value("ai_review"));
    }

    @Test
    void startWork_gitFailure_returns502WithToolError() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.startWork(id)).thenThrow(new GitException(
                "could not create branch", "git checkout -b feature/x", "fatal: not a git repository"));

        mockMvc.perform(post("/tickets/{id}/start", id))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("GIT_ERROR"))
                .andExpect(jsonPath("$.details.error").value("fatal: not a git repository"));
    }

    @Test
    void startWork_persistenceFailure_returns500WithRollbackWarnings() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.startWork(id)).thenThrow(WorkflowException.primaryPersistenceFailure(
                "start work", new RuntimeException("connection reset"),
                List.of("Could not delete branch feature/x")));

        mockMvc.perform(post("/tickets/{id}/start", id))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("PERSISTENCE_FAILED"))
                .andExpect(jsonPath("$.details.rollbackWarnings[0]").value("Could not delete branch feature/x"));
    }

    // ------------------------------------------------------------------
    // POST /tickets/{id}/complete
    // ------------------------------------------------------------------

    @Test
    void completeWork_changed_endsSessions() throws Exception {
        Ticket ticket = ticketIn(TicketStatus.AI_REVIEW);
        TicketSnapshot snapshot = TicketSnapshot.from(ticket);
        when(workflowService.completeWork(ticket.getId(), "Added login form")).thenReturn(
                new CompleteWorkResult(snapshot, TicketStatus.AI_REVIEW, true, 1, "Added login form",
                        List.of("abc1234 Add login form"), List.of("src/Login.tsx"),
                        NextAction.forStatus(TicketStatus.AI_REVIEW), null, List.of()));
        when(sessionAuditor.endSessions(ticket.getId())).thenReturn(2);

        mockMvc.perform(post("/tickets/{id}/complete", ticket.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"summary":"Added login form"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.work.status").value("ai_review"))
                .andExpect(jsonPath("$.work.reviewIteration").value(1))
                .andExpect(jsonPath("$.work.changedFiles[0]").value("src/Login.tsx"))
                .andExpect(jsonPath("$.work.nextActions[0]").value("RUN_REVIEW_AGENTS"))
                .andExpect(jsonPath("$.sessionsEnded").value(2));
    }

    @Test
    void completeWork_unchanged_leavesSessionsAlone() throws Exception {
        Ticket ticket = ticketIn(TicketStatus.HUMAN_REVIEW);
        when(workflowService.completeWork(ticket.getId(), null))
                .thenReturn(CompleteWorkResult.unchanged(TicketSnapshot.from(ticket), null));

        mockMvc.perform(post("/tickets/{id}/complete", ticket.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.work.changed").value(false))
                .andExpect(jsonPath("$.sessionsEnded").value(0));
        verify(sessionAuditor, never()).endSessions(any());
    }

    // ------------------------------------------------------------------
    // POST /tickets/{id}/return-to-implementation, POST /epics/{id}/start
    // ------------------------------------------------------------------

    @Test
    void returnToImplementation_returnsTicket() throws Exception {
        Ticket ticket = ticketIn(TicketStatus.IN_PROGRESS);
        when(workflowService.returnToImplementation(ticket.getId()))
                .thenReturn(new TransitionResult(TicketSnapshot.from(ticket), true, List.of()));

        mockMvc.perform(post("/tickets/{id}/return-to-implementation", ticket.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ticket.status").value("in_progress"))
                .andExpect(jsonPath("$.changed").value(true));
    }

    @Test
    void startEpicWork_passesCreatePrFlag() throws Exception {
        UUID epicId = UUID.randomUUID();
        when(workflowService.startEpicWork(epicId, true)).thenReturn(new StartEpicWorkResult(
                epicId, "Auth", "feature/epic-12345678-auth", true, "/work/app",
                42, "https://github.com/acme/app/pull/42", PrStatus.DRAFT, 3, 1, List.of(), List.of()));

        mockMvc.perform(post("/epics/{id}/start", epicId).param("createPr", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.branchName").value("feature/epic-12345678-auth"))
                .andExpect(jsonPath("$.prNumber").value(42))
                .andExpect(jsonPath("$.prStatus").value("draft"));
    }

    @Test
    void startEpicWork_missingBranch_returns409() throws Exception {
        UUID epicId = UUID.randomUUID();
        when(workflowService.startEpicWork(epicId, false)).thenThrow(
                WorkflowException.epicBranchMissing(epicId, "feature/epic-x", "no longer exists"));

        mockMvc.perform(post("/epics/{id}/start", epicId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EPIC_BRANCH_MISSING"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Ticket ticketIn(TicketStatus status) {
        Project project = TestEntities.project("/work/app");
        return TestEntities.ticket(project, null, "Login form", status);
    }

    private static StartWorkResult startResult(Ticket ticket, List<String> warnings) {
        return new StartWorkResult(TicketSnapshot.from(ticket), ticket.getBranchName(), true, false, null,
                "/work/app", false, warnings);
    }
}
