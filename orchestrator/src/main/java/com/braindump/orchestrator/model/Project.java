package com.braindump.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A local git repository that tickets and epics are worked on in.
 *
 * DB table: projects
 */
@Entity
@Table(name = "projects")
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    // Absolute path of the repository's main working tree.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String path;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Project() {}

    public Project(String name, String path) {
        this.name = name;
        this.path = path;
    }

    public UUID getId()           { return id; }
    public String getName()       { return name; }
    public String getPath()       { return path; }
    public Instant getCreatedAt() { return createdAt; }

    public void setPath(String path) { this.path = path; }
}
