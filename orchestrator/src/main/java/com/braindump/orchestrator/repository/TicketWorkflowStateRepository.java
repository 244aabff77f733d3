package com.braindump.orchestrator.repository;

import com.braindump.orchestrator.model.TicketWorkflowState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface TicketWorkflowStateRepository extends JpaRepository<TicketWorkflowState, UUID> {

    Optional<TicketWorkflowState> findByTicketId(UUID ticketId);
}
