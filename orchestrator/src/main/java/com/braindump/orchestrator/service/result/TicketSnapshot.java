package com.braindump.orchestrator.service.result;

import com.braindump.orchestrator.model.Priority;
import com.braindump.orchestrator.model.Ticket;
import com.braindump.orchestrator.model.TicketMetadata;
import com.braindump.orchestrator.model.TicketStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Read-only view of a ticket as returned by workflow operations. */
public record TicketSnapshot(
        UUID id,
        String title,
        TicketStatus status,
        Priority priority,
        String branchName,
        UUID projectId,
        UUID epicId,
        boolean metadataAvailable,
        List<String> tags,
        Instant updatedAt
) {

    public static TicketSnapshot from(Ticket ticket) {
        TicketMetadata metadata = ticket.getMetadata() != null ? ticket.getMetadata() : TicketMetadata.empty();
        return new TicketSnapshot(
                ticket.getId(),
                ticket.getTitle(),
                ticket.getStatus(),
                ticket.getPriority(),
                ticket.getBranchName(),
                ticket.getProject().getId(),
                ticket.getEpic() != null ? ticket.getEpic().getId() : null,
                metadata.available(),
                metadata.tags(),
                ticket.getUpdatedAt());
    }
}
