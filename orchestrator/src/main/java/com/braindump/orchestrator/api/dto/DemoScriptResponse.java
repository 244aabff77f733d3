package com.braindump.orchestrator.api.dto;

import com.braindump.orchestrator.model.DemoScript;
import com.braindump.orchestrator.model.DemoStep;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record DemoScriptResponse(UUID id, UUID ticketId, List<DemoStep> steps, Instant generatedAt) {

    public static DemoScriptResponse from(DemoScript demo) {
        return new DemoScriptResponse(demo.getId(), demo.getTicketId(), demo.getSteps(), demo.getGeneratedAt());
    }
}
