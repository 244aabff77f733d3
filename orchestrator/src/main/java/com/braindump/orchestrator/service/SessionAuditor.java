package com.braindump.orchestrator.service;

import com.braindump.orchestrator.error.WorkflowException;
import com.braindump.orchestrator.model.ConversationSession;
import com.braindump.orchestrator.model.Ticket;
import com.braindump.orchestrator.repository.ConversationSessionRepository;
import com.braindump.orchestrator.repository.TicketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps an audit trail of agent sessions per ticket. A ticket has at most one open
 * session: opening a new one ends any left over.
 */
@Service
public class SessionAuditor {

    private static final Logger log = LoggerFactory.getLogger(SessionAuditor.class);

    private final ConversationSessionRepository sessionRepo;
    private final TicketRepository              ticketRepo;
    private final String                        defaultEnvironment;

    public SessionAuditor(ConversationSessionRepository sessionRepo,
                          TicketRepository ticketRepo,
                          @Value("${braindump.session.environment:claude-code}") String defaultEnvironment) {
        this.sessionRepo        = sessionRepo;
        this.ticketRepo         = ticketRepo;
        this.defaultEnvironment = defaultEnvironment;
    }

    @Transactional
    public ConversationSession startSession(UUID ticketId, String environment) {
        Ticket ticket = ticketRepo.findById(ticketId)
                .orElseThrow(() -> WorkflowException.ticketNotFound(ticketId));

        int ended = endOpen(ticketId);
        if (ended > 0) {
            log.info("Ended {} stale session(s) for ticket {}", ended, ticketId);
        }

        String env = environment == null || environment.isBlank() ? defaultEnvironment : environment;
        ConversationSession session = sessionRepo.save(
                new ConversationSession(ticketId, ticket.getProject().getId(), env));
        log.info("Session {} started for ticket {} ({})", session.getId(), ticketId, env);
        return session;
    }

    /** @return how many sessions were ended */
    @Transactional
    public int endSessions(UUID ticketId) {
        int ended = endOpen(ticketId);
        log.info("Ended {} session(s) for ticket {}", ended, ticketId);
        return ended;
    }

    @Transactional(readOnly = true)
    public Optional<ConversationSession> findActiveSession(UUID ticketId) {
        return sessionRepo.findFirstByTicketIdAndEndedAtIsNullOrderByStartedAtDesc(ticketId);
    }

    private int endOpen(UUID ticketId) {
        List<ConversationSession> open = sessionRepo.findByTicketIdAndEndedAtIsNull(ticketId);
        open.forEach(ConversationSession::end);
        sessionRepo.saveAll(open);
        return open.size();
    }
}
