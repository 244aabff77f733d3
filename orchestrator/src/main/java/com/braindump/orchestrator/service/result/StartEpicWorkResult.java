package com.braindump.orchestrator.service.result;

import com.braindump.orchestrator.model.PrStatus;

import java.util.List;
import java.util.UUID;

public record StartEpicWorkResult(
        UUID epicId,
        String epicTitle,
        String branchName,
        boolean branchCreated,
        String workingDirectory,
        Integer prNumber,
        String prUrl,
        PrStatus prStatus,
        int ticketsTotal,
        int ticketsDone,
        List<TicketRef> tickets,
        List<String> warnings
) {

    public StartEpicWorkResult {
        tickets  = List.copyOf(tickets);
        warnings = List.copyOf(warnings);
    }
}
