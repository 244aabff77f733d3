package com.braindump.orchestrator.api.dto;

import com.braindump.orchestrator.model.DemoStep;

import java.util.List;

/** Request body for POST /tickets/{id}/demo. At least three steps. */
public record GenerateDemoRequest(List<DemoStep> steps) {}
