package com.braindump.orchestrator.api;

import com.braindump.orchestrator.api.dto.CompleteWorkRequest;
import com.braindump.orchestrator.api.dto.CompleteWorkResponse;
import com.braindump.orchestrator.api.dto.StartWorkRequest;
import com.braindump.orchestrator.api.dto.StartWorkResponse;
import com.braindump.orchestrator.service.SessionAuditor;
import com.braindump.orchestrator.service.WorkflowService;
import com.braindump.orchestrator.service.result.CompleteWorkResult;
import com.braindump.orchestrator.service.result.StartEpicWorkResult;
import com.braindump.orchestrator.service.result.StartWorkResult;
import com.braindump.orchestrator.service.result.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * REST API for the ticket and epic workflow.
 *
 * POST /tickets/{id}/start                     start work (branch + in_progress)
 * POST /tickets/{id}/complete                  hand over to AI review
 * POST /tickets/{id}/return-to-implementation  fix loop: ai_review back to in_progress
 * POST /epics/{id}/start?createPr=true         prepare the epic branch, optionally a draft PR
 *
 * Opening and closing the audit session is done here, after the workflow call;
 * failures there only add warnings.
 */
@RestController
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowService workflowService;
    private final SessionAuditor  sessionAuditor;

    public WorkflowController(WorkflowService workflowService, SessionAuditor sessionAuditor) {
        this.workflowService = workflowService;
        this.sessionAuditor  = sessionAuditor;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/tickets/{id}/start \
     *     -H "Content-Type: application/json" -d '{"environment":"vscode"}'
     */
    @PostMapping("/tickets/{id}/start")
    public StartWorkResponse startWork(@PathVariable UUID id,
                                       @RequestBody(required = false) StartWorkRequest req) {
        StartWorkResult result = workflowService.startWork(id);
        List<String> warnings = new ArrayList<>(result.warnings());
        UUID sessionId = null;
        try {
            sessionId = sessionAuditor.startSession(id, req != null ? req.environment() : null).getId();
        } catch (RuntimeException e) {
            log.warn("Could not open session for ticket {}: {}", id, e.getMessage());
            warnings.add("Conversation session could not be started: " + e.getMessage());
        }
        return new StartWorkResponse(result, sessionId, warnings);
    }

    @PostMapping("/tickets/{id}/complete")
    public CompleteWorkResponse completeWork(@PathVariable UUID id,
                                             @RequestBody(required = false) CompleteWorkRequest req) {
        CompleteWorkResult result = workflowService.completeWork(id, req != null ? req.summary() : null);
        List<String> warnings = new ArrayList<>(result.warnings());
        int ended = 0;
        if (result.changed()) {
            try {
                ended = sessionAuditor.endSessions(id);
            } catch (RuntimeException e) {
                log.warn("Could not end sessions for ticket {}: {}", id, e.getMessage());
                warnings.add("Conversation sessions could not be ended: " + e.getMessage());
            }
        }
        return new CompleteWorkResponse(result, ended, warnings);
    }

    @PostMapping("/tickets/{id}/return-to-implementation")
    public TransitionResult returnToImplementation(@PathVariable UUID id) {
        return workflowService.returnToImplementation(id);
    }

    @PostMapping("/epics/{id}/start")
    public StartEpicWorkResult startEpicWork(@PathVariable UUID id,
                                             @RequestParam(defaultValue = "false") boolean createPr) {
        return workflowService.startEpicWork(id, createPr);
    }
}
