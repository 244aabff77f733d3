package com.braindump.orchestrator.api.dto;

/** Request body for POST /tickets/{id}/complete. The summary is optional. */
public record CompleteWorkRequest(String summary) {}
