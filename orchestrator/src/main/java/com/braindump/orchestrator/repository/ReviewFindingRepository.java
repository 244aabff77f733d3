package com.braindump.orchestrator.repository;

import com.braindump.orchestrator.model.ReviewFinding;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ReviewFindingRepository extends JpaRepository<ReviewFinding, UUID> {

    /** Newest first. */
    List<ReviewFinding> findByTicketIdOrderByCreatedAtDesc(UUID ticketId);
}
