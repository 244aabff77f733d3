package com.braindump.orchestrator.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Thrown by the workflow engine when an operation cannot complete.
 *
 * Unchecked so callers only catch it at the presentation boundary, where the
 * {@link Kind} decides how the failure is reported. Secondary failures never
 * surface as this exception; they travel as warnings on the result records.
 */
public class WorkflowException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,                      // ticket, epic, finding or project path missing
        PRECONDITION_VIOLATED,          // wrong status, review gate closed, invalid input
        EXTERNAL_TOOL_FAILURE,          // git / gh exited non-zero
        PRIMARY_PERSISTENCE_FAILURE     // ticket status or branch write failed
    }

    private final Kind kind;
    private final String code;
    private final Map<String, Object> details;

    public WorkflowException(Kind kind, String code, String message, Map<String, Object> details) {
        super(message);
        this.kind    = kind;
        this.code    = code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public WorkflowException(Kind kind, String code, String message,
                             Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind    = kind;
        this.code    = code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public Kind getKind()                  { return kind; }
    public String getCode()                { return code; }
    public Map<String, Object> getDetails() { return details; }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public static WorkflowException ticketNotFound(UUID ticketId) {
        return new WorkflowException(Kind.NOT_FOUND, "TICKET_NOT_FOUND",
                "Ticket not found: " + ticketId, Map.of("ticketId", ticketId.toString()));
    }

    public static WorkflowException epicNotFound(UUID epicId) {
        return new WorkflowException(Kind.NOT_FOUND, "EPIC_NOT_FOUND",
                "Epic not found: " + epicId, Map.of("epicId", epicId.toString()));
    }

    public static WorkflowException findingNotFound(UUID findingId) {
        return new WorkflowException(Kind.NOT_FOUND, "FINDING_NOT_FOUND",
                "Review finding not found: " + findingId, Map.of("findingId", findingId.toString()));
    }

    public static WorkflowException pathNotFound(String path) {
        return new WorkflowException(Kind.NOT_FOUND, "PATH_NOT_FOUND",
                "Project path does not exist: " + path, Map.of("path", String.valueOf(path)));
    }

    public static WorkflowException invalidState(String resource, String currentState,
                                                 String requiredState, String action) {
        return new WorkflowException(Kind.PRECONDITION_VIOLATED, "INVALID_STATE",
                "Cannot %s: %s is in '%s' state, must be '%s'."
                        .formatted(action, resource, currentState, requiredState),
                Map.of("resource", resource, "currentState", currentState,
                       "requiredState", requiredState, "action", action));
    }

    public static WorkflowException validation(String message) {
        return new WorkflowException(Kind.PRECONDITION_VIOLATED, "VALIDATION_ERROR", message, Map.of());
    }

    /**
     * The epic has a recorded branch (or worktree) that is gone from the repository.
     * Substituting a new branch would split the epic's history, so the caller has to
     * re-run epic initialisation explicitly.
     */
    public static WorkflowException epicBranchMissing(UUID epicId, String branchName, String reason) {
        return new WorkflowException(Kind.PRECONDITION_VIOLATED, "EPIC_BRANCH_MISSING",
                "Epic branch '%s' %s. Re-run epic initialisation (start epic work for %s) and try again."
                        .formatted(branchName, reason, epicId),
                Map.of("epicId", epicId.toString(), "branchName", branchName));
    }

    public static WorkflowException reviewGateClosed(UUID ticketId, List<String> openBlocking,
                                                     long openCritical, long openMajor) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ticketId", ticketId.toString());
        details.put("openCritical", openCritical);
        details.put("openMajor", openMajor);
        details.put("openFindings", List.copyOf(openBlocking));
        return new WorkflowException(Kind.PRECONDITION_VIOLATED, "REVIEW_GATE_CLOSED",
                "Cannot generate demo: %d critical and %d major findings are still open."
                        .formatted(openCritical, openMajor),
                details);
    }

    public static WorkflowException primaryPersistenceFailure(String action, Throwable cause,
                                                              List<String> rollbackWarnings) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", action);
        details.put("rollbackWarnings", List.copyOf(rollbackWarnings));
        return new WorkflowException(Kind.PRIMARY_PERSISTENCE_FAILURE, "PERSISTENCE_FAILED",
                "Failed to %s: %s".formatted(action, rootMessage(cause)), details, cause);
    }

    static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
