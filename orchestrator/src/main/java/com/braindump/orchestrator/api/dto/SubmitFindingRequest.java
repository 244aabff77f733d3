package com.braindump.orchestrator.api.dto;

import com.braindump.orchestrator.model.FindingSeverity;

/**
 * Request body for POST /tickets/{id}/findings.
 *
 * Required: agent, severity, category, description
 * Optional: filePath, lineNumber, suggestedFix
 */
public record SubmitFindingRequest(String agent, FindingSeverity severity, String category,
                                   String description, String filePath, Integer lineNumber,
                                   String suggestedFix) {}
