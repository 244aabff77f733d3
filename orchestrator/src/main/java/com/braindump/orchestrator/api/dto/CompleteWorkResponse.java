package com.braindump.orchestrator.api.dto;

import com.braindump.orchestrator.service.result.CompleteWorkResult;

import java.util.List;

/** Response body for POST /tickets/{id}/complete. */
public record CompleteWorkResponse(CompleteWorkResult work, int sessionsEnded, List<String> warnings) {}
