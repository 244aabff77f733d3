package com.braindump.orchestrator.api.dto;

public record MarkFixedRequest(String fixDescription) {}
