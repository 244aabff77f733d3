package com.braindump.orchestrator.service.result;

import com.braindump.orchestrator.model.Ticket;
import com.braindump.orchestrator.model.TicketStatus;

import java.util.UUID;

public record TicketRef(UUID id, String title, TicketStatus status) {

    public static TicketRef from(Ticket ticket) {
        return new TicketRef(ticket.getId(), ticket.getTitle(), ticket.getStatus());
    }
}
