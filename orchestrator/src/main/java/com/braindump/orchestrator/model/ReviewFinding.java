package com.braindump.orchestrator.model;

import com.braindump.orchestrator.model.convert.EnumConverters.FindingSeverityConverter;
import com.braindump.orchestrator.model.convert.EnumConverters.FindingStatusConverter;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * An issue raised by a review agent against a ticket during AI review.
 *
 * DB table: review_findings
 */
@Entity
@Table(name = "review_findings")
public class ReviewFinding {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "ticket_id", nullable = false)
    private UUID ticketId;

    // Review iteration the finding was raised in.
    @Column(nullable = false)
    private int iteration;

    // Name of the reviewing agent, e.g. "code-reviewer".
    @Column(nullable = false)
    private String agent;

    @Convert(converter = FindingSeverityConverter.class)
    @Column(nullable = false)
    private FindingSeverity severity;

    @Column(nullable = false)
    private String category;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "file_path", columnDefinition = "TEXT")
    private String filePath;

    @Column(name = "line_number")
    private Integer lineNumber;

    @Column(name = "suggested_fix", columnDefinition = "TEXT")
    private String suggestedFix;

    @Convert(converter = FindingStatusConverter.class)
    @Column(nullable = false)
    private FindingStatus status = FindingStatus.OPEN;

    @Column(name = "fix_description", columnDefinition = "TEXT")
    private String fixDescription;

    @Column(name = "fixed_at")
    private Instant fixedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ReviewFinding() {}

    public ReviewFinding(UUID ticketId, int iteration, String agent, FindingSeverity severity,
                         String category, String description) {
        this.ticketId    = ticketId;
        this.iteration   = iteration;
        this.agent       = agent;
        this.severity    = severity;
        this.category    = category;
        this.description = description;
    }

    /** @return false if the finding was already fixed */
    public boolean markFixed(String fixDescription) {
        if (status == FindingStatus.FIXED) {
            return false;
        }
        this.status         = FindingStatus.FIXED;
        this.fixDescription = fixDescription;
        this.fixedAt        = Instant.now();
        return true;
    }

    /** Open and severe enough to keep the ticket out of human review. */
    public boolean isBlocking() {
        return status == FindingStatus.OPEN && severity.isBlocking();
    }

    public UUID getId()                 { return id; }
    public UUID getTicketId()           { return ticketId; }
    public int getIteration()           { return iteration; }
    public String getAgent()            { return agent; }
    public FindingSeverity getSeverity(){ return severity; }
    public String getCategory()         { return category; }
    public String getDescription()      { return description; }
    public String getFilePath()         { return filePath; }
    public Integer getLineNumber()      { return lineNumber; }
    public String getSuggestedFix()     { return suggestedFix; }
    public FindingStatus getStatus()    { return status; }
    public String getFixDescription()   { return fixDescription; }
    public Instant getFixedAt()         { return fixedAt; }
    public Instant getCreatedAt()       { return createdAt; }

    public void setFilePath(String filePath)         { this.filePath = filePath; }
    public void setLineNumber(Integer lineNumber)    { this.lineNumber = lineNumber; }
    public void setSuggestedFix(String suggestedFix) { this.suggestedFix = suggestedFix; }
}
