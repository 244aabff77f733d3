package com.braindump.orchestrator.service;

import com.braindump.orchestrator.error.WorkflowException;
import com.braindump.orchestrator.model.*;
import com.braindump.orchestrator.repository.DemoScriptRepository;
import com.braindump.orchestrator.repository.ReviewFindingRepository;
import com.braindump.orchestrator.repository.TicketRepository;
import com.braindump.orchestrator.repository.TicketWorkflowStateRepository;
import com.braindump.orchestrator.service.result.ReviewCompletionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * AI review bookkeeping and the gate into human review.
 *
 * Review agents submit findings against a ticket in AI_REVIEW; fixes are recorded
 * against individual findings. A demo script can only be generated, and the ticket
 * moved to HUMAN_REVIEW, once no critical or major finding is open. Generating the
 * demo is the only way into HUMAN_REVIEW.
 */
@Service
public class ReviewGateService {

    private static final Logger log = LoggerFactory.getLogger(ReviewGateService.class);

    static final int MIN_DEMO_STEPS = 3;

    private final TicketRepository              ticketRepo;
    private final ReviewFindingRepository       findingRepo;
    private final TicketWorkflowStateRepository workflowStateRepo;
    private final DemoScriptRepository          demoRepo;

    public ReviewGateService(TicketRepository ticketRepo,
                             ReviewFindingRepository findingRepo,
                             TicketWorkflowStateRepository workflowStateRepo,
                             DemoScriptRepository demoRepo) {
        this.ticketRepo        = ticketRepo;
        this.findingRepo       = findingRepo;
        this.workflowStateRepo = workflowStateRepo;
        this.demoRepo          = demoRepo;
    }

    // ------------------------------------------------------------------
    // Findings
    // ------------------------------------------------------------------

    /**
     * Records a finding for the current review iteration.
     *
     * @throws WorkflowException NOT_FOUND for an unknown ticket, PRECONDITION_VIOLATED
     *                           when the ticket is not in AI review or input is missing
     */
    @Transactional
    public ReviewFinding submitFinding(NewFinding input) {
        requireText(input.agent(), "agent");
        requireText(input.category(), "category");
        requireText(input.description(), "description");
        if (input.severity() == null) {
            throw WorkflowException.validation("severity is required");
        }

        Ticket ticket = requireTicketInAiReview(input.ticketId(), "submit finding");
        TicketWorkflowState state = workflowState(ticket.getId());

        ReviewFinding finding = new ReviewFinding(ticket.getId(), state.getReviewIteration(),
                input.agent(), input.severity(), input.category(), input.description());
        finding.setFilePath(input.filePath());
        finding.setLineNumber(input.lineNumber());
        finding.setSuggestedFix(input.suggestedFix());
        finding = findingRepo.save(finding);

        state.recordFinding();
        workflowStateRepo.save(state);

        log.info("Finding {} ({}/{}) on ticket {} by {}", finding.getId(),
                finding.getSeverity().value(), finding.getCategory(), ticket.getId(), finding.getAgent());
        return finding;
    }

    /** Marks a finding fixed. Marking an already fixed finding again changes nothing. */
    @Transactional
    public ReviewFinding markFixed(UUID findingId, String fixDescription) {
        ReviewFinding finding = findingRepo.findById(findingId)
                .orElseThrow(() -> WorkflowException.findingNotFound(findingId));
        if (!finding.markFixed(fixDescription)) {
            return finding;
        }
        finding = findingRepo.save(finding);

        TicketWorkflowState state = workflowState(finding.getTicketId());
        state.recordFix();
        workflowStateRepo.save(state);

        log.info("Finding {} on ticket {} marked fixed", findingId, finding.getTicketId());
        return finding;
    }

    @Transactional(readOnly = true)
    public List<ReviewFinding> getFindings(UUID ticketId, FindingFilter filter) {
        requireTicket(ticketId);
        FindingFilter f = filter != null ? filter : FindingFilter.all();
        return findingRepo.findByTicketIdOrderByCreatedAtDesc(ticketId).stream()
                .filter(f::matches)
                .toList();
    }

    // ------------------------------------------------------------------
    // Gate
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public ReviewCompletionStatus checkComplete(UUID ticketId) {
        requireTicket(ticketId);
        List<ReviewFinding> findings = findingRepo.findByTicketIdOrderByCreatedAtDesc(ticketId);

        long critical = countOpen(findings, FindingSeverity.CRITICAL);
        long major    = countOpen(findings, FindingSeverity.MAJOR);
        long fixed    = findings.stream().filter(f -> f.getStatus() == FindingStatus.FIXED).count();

        return new ReviewCompletionStatus(ticketId,
                critical == 0 && major == 0,
                critical,
                major,
                countOpen(findings, FindingSeverity.MINOR),
                countOpen(findings, FindingSeverity.SUGGESTION),
                findings.size(),
                fixed);
    }

    /**
     * Stores the demo script and moves the ticket to HUMAN_REVIEW.
     *
     * Refuses while any critical or major finding is open; the refusal lists them.
     * A script generated earlier for the same ticket is replaced.
     */
    @Transactional
    public DemoScript generateDemoScript(UUID ticketId, List<DemoStep> steps) {
        Ticket ticket = requireTicketInAiReview(ticketId, "generate demo");
        if (steps == null || steps.size() < MIN_DEMO_STEPS) {
            throw WorkflowException.validation(
                    "A demo script needs at least " + MIN_DEMO_STEPS + " steps");
        }

        List<ReviewFinding> blocking = findingRepo.findByTicketIdOrderByCreatedAtDesc(ticketId).stream()
                .filter(ReviewFinding::isBlocking)
                .toList();
        if (!blocking.isEmpty()) {
            List<String> described = blocking.stream()
                    .map(f -> "[%s] %s: %s (%s)".formatted(
                            f.getSeverity().value(), f.getCategory(), f.getDescription(), f.getId()))
                    .toList();
            log.info("Demo for ticket {} refused: {} blocking findings open", ticketId, blocking.size());
            throw WorkflowException.reviewGateClosed(ticketId, described,
                    countOpen(blocking, FindingSeverity.CRITICAL), countOpen(blocking, FindingSeverity.MAJOR));
        }

        List<DemoStep> ordered = numbered(steps);
        DemoScript demo = demoRepo.findByTicketId(ticketId)
                .map(existing -> {
                    existing.replaceSteps(ordered);
                    return existing;
                })
                .orElseGet(() -> new DemoScript(ticketId, ordered));
        demo = demoRepo.save(demo);

        TicketWorkflowState state = workflowState(ticketId);
        state.markDemoGenerated();
        workflowStateRepo.save(state);

        ticket.transitionTo(TicketStatus.HUMAN_REVIEW);
        ticketRepo.save(ticket);

        log.info("Demo script with {} steps generated; ticket {} -> human_review", ordered.size(), ticketId);
        return demo;
    }

    @Transactional(readOnly = true)
    public Optional<DemoScript> getDemoScript(UUID ticketId) {
        requireTicket(ticketId);
        return demoRepo.findByTicketId(ticketId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Ticket requireTicket(UUID ticketId) {
        return ticketRepo.findById(ticketId)
                .orElseThrow(() -> WorkflowException.ticketNotFound(ticketId));
    }

    private Ticket requireTicketInAiReview(UUID ticketId, String action) {
        Ticket ticket = requireTicket(ticketId);
        if (ticket.getStatus() != TicketStatus.AI_REVIEW) {
            throw WorkflowException.invalidState("ticket", ticket.getStatus().value(),
                    TicketStatus.AI_REVIEW.value(), action);
        }
        return ticket;
    }

    // Findings can arrive for a ticket whose state row was never written.
    private TicketWorkflowState workflowState(UUID ticketId) {
        return workflowStateRepo.findByTicketId(ticketId)
                .orElseGet(() -> new TicketWorkflowState(ticketId, WorkflowPhase.AI_REVIEW, 1));
    }

    private static long countOpen(List<ReviewFinding> findings, FindingSeverity severity) {
        return findings.stream()
                .filter(f -> f.getStatus() == FindingStatus.OPEN && f.getSeverity() == severity)
                .count();
    }

    // Steps without an explicit order take their list position (1-based).
    private static List<DemoStep> numbered(List<DemoStep> steps) {
        List<DemoStep> result = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            DemoStep s = steps.get(i);
            if (s.description() == null || s.description().isBlank()) {
                throw WorkflowException.validation("Demo step " + (i + 1) + " has no description");
            }
            int order = s.order() > 0 ? s.order() : i + 1;
            result.add(new DemoStep(order, s.description(), s.expectedOutcome(), s.type(), s.status(), s.notes()));
        }
        return result;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw WorkflowException.validation(field + " is required");
        }
    }
}
