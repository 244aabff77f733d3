package com.braindump.orchestrator.model.convert;

import com.braindump.orchestrator.model.*;
import jakarta.persistence.Converter;

public final class EnumConverters {

    private EnumConverters() {}

    @Converter
    public static class TicketStatusConverter extends PersistedValueConverter<TicketStatus> {
        public TicketStatusConverter() { super(TicketStatus.class); }
    }

    @Converter
    public static class WorkflowPhaseConverter extends PersistedValueConverter<WorkflowPhase> {
        public WorkflowPhaseConverter() { super(WorkflowPhase.class); }
    }

    @Converter
    public static class FindingSeverityConverter extends PersistedValueConverter<FindingSeverity> {
        public FindingSeverityConverter() { super(FindingSeverity.class); }
    }

    @Converter
    public static class FindingStatusConverter extends PersistedValueConverter<FindingStatus> {
        public FindingStatusConverter() { super(FindingStatus.class); }
    }

    @Converter
    public static class IsolationModeConverter extends PersistedValueConverter<IsolationMode> {
        public IsolationModeConverter() { super(IsolationMode.class); }
    }

    @Converter
    public static class PriorityConverter extends PersistedValueConverter<Priority> {
        public PriorityConverter() { super(Priority.class); }
    }

    @Converter
    public static class PrStatusConverter extends PersistedValueConverter<PrStatus> {
        public PrStatusConverter() { super(PrStatus.class); }
    }
}
