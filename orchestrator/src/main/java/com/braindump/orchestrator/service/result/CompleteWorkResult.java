package com.braindump.orchestrator.service.result;

import com.braindump.orchestrator.model.TicketStatus;

import java.util.List;

/**
 * Result of completing implementation work on a ticket.
 *
 * @param changed          false when the ticket was already past implementation
 * @param reviewIteration  null when the workflow state could not be updated (see warnings)
 */
public record CompleteWorkResult(
        TicketSnapshot ticket,
        TicketStatus status,
        boolean changed,
        Integer reviewIteration,
        String workSummary,
        List<String> commits,
        List<String> changedFiles,
        List<NextAction> nextActions,
        TicketRef suggestedNextTicket,
        List<String> warnings
) {

    public CompleteWorkResult {
        commits      = List.copyOf(commits);
        changedFiles = List.copyOf(changedFiles);
        nextActions  = List.copyOf(nextActions);
        warnings     = List.copyOf(warnings);
    }

    /** Nothing to do: the ticket is already in review or done. */
    public static CompleteWorkResult unchanged(TicketSnapshot ticket, String workSummary) {
        return new CompleteWorkResult(ticket, ticket.status(), false, null, workSummary,
                List.of(), List.of(), NextAction.forStatus(ticket.status()), null, List.of());
    }
}
