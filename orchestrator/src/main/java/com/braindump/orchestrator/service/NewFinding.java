package com.braindump.orchestrator.service;

import com.braindump.orchestrator.model.FindingSeverity;

import java.util.UUID;

/** A finding as submitted by a review agent. File path, line and suggested fix are optional. */
public record NewFinding(
        UUID ticketId,
        String agent,
        FindingSeverity severity,
        String category,
        String description,
        String filePath,
        Integer lineNumber,
        String suggestedFix
) {}
