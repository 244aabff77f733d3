package com.braindump.orchestrator.service.result;

import java.util.UUID;

/**
 * Open findings per severity for a ticket. Human review may start only when no
 * critical or major finding is open.
 */
public record ReviewCompletionStatus(
        UUID ticketId,
        boolean canProceedToHumanReview,
        long openCritical,
        long openMajor,
        long openMinor,
        long openSuggestion,
        long totalFindings,
        long fixedFindings
) {}
