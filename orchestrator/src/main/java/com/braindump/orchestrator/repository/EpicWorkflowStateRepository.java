package com.braindump.orchestrator.repository;

import com.braindump.orchestrator.model.EpicWorkflowState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface EpicWorkflowStateRepository extends JpaRepository<EpicWorkflowState, UUID> {

    Optional<EpicWorkflowState> findByEpicId(UUID epicId);
}
