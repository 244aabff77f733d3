package com.braindump.orchestrator.service;

import com.braindump.orchestrator.model.FindingSeverity;
import com.braindump.orchestrator.model.FindingStatus;
import com.braindump.orchestrator.model.ReviewFinding;

/** Optional criteria for listing findings; null fields match everything. */
public record FindingFilter(FindingStatus status, FindingSeverity severity, String agent) {

    public static FindingFilter all() {
        return new FindingFilter(null, null, null);
    }

    public boolean matches(ReviewFinding finding) {
        return (status == null || finding.getStatus() == status)
                && (severity == null || finding.getSeverity() == severity)
                && (agent == null || agent.equals(finding.getAgent()));
    }
}
