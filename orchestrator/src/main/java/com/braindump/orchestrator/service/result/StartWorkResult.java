package com.braindump.orchestrator.service.result;

import java.util.List;

/**
 * Result of starting work on a ticket.
 *
 * @param epicBranch       the epic's branch when {@code usingEpicBranch}, else null
 * @param workingDirectory where the branch is checked out (an epic worktree, or the project)
 * @param alreadyStarted   true when the ticket was already in progress and nothing changed
 */
public record StartWorkResult(
        TicketSnapshot ticket,
        String branchName,
        boolean branchCreated,
        boolean usingEpicBranch,
        String epicBranch,
        String workingDirectory,
        boolean alreadyStarted,
        List<String> warnings
) {

    public StartWorkResult {
        warnings = List.copyOf(warnings);
    }
}
