package com.braindump.orchestrator.model;

import com.braindump.orchestrator.model.convert.DemoStepsConverter;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Steps a human follows to verify a ticket before approving it. One per ticket.
 *
 * DB table: demo_scripts
 */
@Entity
@Table(name = "demo_scripts")
public class DemoScript {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "ticket_id", nullable = false, unique = true)
    private UUID ticketId;

    @Convert(converter = DemoStepsConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<DemoStep> steps;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt = Instant.now();

    protected DemoScript() {}

    public DemoScript(UUID ticketId, List<DemoStep> steps) {
        this.ticketId = ticketId;
        this.steps    = List.copyOf(steps);
    }

    public void replaceSteps(List<DemoStep> steps) {
        this.steps       = List.copyOf(steps);
        this.generatedAt = Instant.now();
    }

    public UUID getId()              { return id; }
    public UUID getTicketId()        { return ticketId; }
    public List<DemoStep> getSteps() { return steps; }
    public Instant getGeneratedAt()  { return generatedAt; }
}
