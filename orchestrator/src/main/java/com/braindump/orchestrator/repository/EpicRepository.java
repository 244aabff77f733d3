package com.braindump.orchestrator.repository;

import com.braindump.orchestrator.model.Epic;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface EpicRepository extends JpaRepository<Epic, UUID> {
}
