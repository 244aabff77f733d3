package com.braindump.orchestrator.service.result;

import java.util.List;

public record TransitionResult(TicketSnapshot ticket, boolean changed, List<String> warnings) {

    public TransitionResult {
        warnings = List.copyOf(warnings);
    }
}
