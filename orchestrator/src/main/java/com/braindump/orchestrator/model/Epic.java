package com.braindump.orchestrator.model;

import com.braindump.orchestrator.model.convert.EnumConverters.IsolationModeConverter;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A group of tickets that are implemented on one shared branch.
 *
 * DB table: epics
 */
@Entity
@Table(name = "epics")
public class Epic {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @ManyToOne(optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @Convert(converter = IsolationModeConverter.class)
    @Column(name = "isolation_mode", nullable = false)
    private IsolationMode isolationMode = IsolationMode.SHARED_BRANCH;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Epic() {}

    public Epic(Project project, String title, IsolationMode isolationMode) {
        this.project       = project;
        this.title         = title;
        this.isolationMode = isolationMode;
    }

    public UUID getId()                     { return id; }
    public String getTitle()                { return title; }
    public String getDescription()          { return description; }
    public Project getProject()             { return project; }
    public IsolationMode getIsolationMode() { return isolationMode; }
    public Instant getCreatedAt()           { return createdAt; }

    public void setDescription(String description)       { this.description = description; }
    public void setIsolationMode(IsolationMode mode)     { this.isolationMode = mode; }
}
