package com.braindump.orchestrator.api.dto;

import com.braindump.orchestrator.service.result.StartWorkResult;

import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /tickets/{id}/start.
 *
 * {@code warnings} merges the engine's warnings with any failure to open the audit session,
 * in which case {@code sessionId} is null.
 */
public record StartWorkResponse(StartWorkResult work, UUID sessionId, List<String> warnings) {}
