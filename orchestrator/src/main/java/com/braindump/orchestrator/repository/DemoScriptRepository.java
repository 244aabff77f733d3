package com.braindump.orchestrator.repository;

import com.braindump.orchestrator.model.DemoScript;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface DemoScriptRepository extends JpaRepository<DemoScript, UUID> {

    Optional<DemoScript> findByTicketId(UUID ticketId);
}
