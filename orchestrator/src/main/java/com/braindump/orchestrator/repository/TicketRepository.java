package com.braindump.orchestrator.repository;

import com.braindump.orchestrator.model.Ticket;
import com.braindump.orchestrator.model.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + board queries for the tickets table.
 */
public interface TicketRepository extends JpaRepository<Ticket, UUID> {

    long countByEpic_Id(UUID epicId);

    long countByEpic_IdAndStatus(UUID epicId, TicketStatus status);

    /** Tickets of an epic in board order. */
    List<Ticket> findByEpic_IdOrderByPositionAsc(UUID epicId);

    /**
     * First ticket of the project in the given status, other than {@code excludedId}.
     * Used to suggest what to pick up after completing a ticket.
     */
    Optional<Ticket> findFirstByProject_IdAndIdNotAndStatusOrderByPositionAsc(
            UUID projectId, UUID excludedId, TicketStatus status);
}
