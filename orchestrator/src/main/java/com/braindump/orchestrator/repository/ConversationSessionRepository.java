package com.braindump.orchestrator.repository;

import com.braindump.orchestrator.model.ConversationSession;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConversationSessionRepository extends JpaRepository<ConversationSession, UUID> {

    /** Sessions for the ticket that were never ended. */
    List<ConversationSession> findByTicketIdAndEndedAtIsNull(UUID ticketId);

    Optional<ConversationSession> findFirstByTicketIdAndEndedAtIsNullOrderByStartedAtDesc(UUID ticketId);
}
