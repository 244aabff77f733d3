package com.braindump.orchestrator.api.dto;

import java.util.Map;

/** Body of every error response: a stable machine code, a message and optional details. */
public record ErrorResponse(String code, String message, Map<String, Object> details) {}
