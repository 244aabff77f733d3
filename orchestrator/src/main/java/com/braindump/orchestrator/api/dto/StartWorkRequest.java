package com.braindump.orchestrator.api.dto;

/** Optional body for POST /tickets/{id}/start: the agent environment label for the audit session. */
public record StartWorkRequest(String environment) {}
