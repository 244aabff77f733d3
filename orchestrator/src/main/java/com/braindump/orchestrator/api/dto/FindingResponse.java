package com.braindump.orchestrator.api.dto;

import com.braindump.orchestrator.model.FindingSeverity;
import com.braindump.orchestrator.model.FindingStatus;
import com.braindump.orchestrator.model.ReviewFinding;

import java.time.Instant;
import java.util.UUID;

public record FindingResponse(
        UUID            id,
        UUID            ticketId,
        int             iteration,
        String          agent,
        FindingSeverity severity,
        String          category,
        String          description,
        String          filePath,
        Integer         lineNumber,
        String          suggestedFix,
        FindingStatus   status,
        String          fixDescription,
        Instant         fixedAt,
        Instant         createdAt
) {
    public static FindingResponse from(ReviewFinding f) {
        return new FindingResponse(f.getId(), f.getTicketId(), f.getIteration(), f.getAgent(),
                f.getSeverity(), f.getCategory(), f.getDescription(), f.getFilePath(),
                f.getLineNumber(), f.getSuggestedFix(), f.getStatus(), f.getFixDescription(),
                f.getFixedAt(), f.getCreatedAt());
    }
}
