package com.braindump.orchestrator.api;

import com.braindump.orchestrator.api.dto.*;
import com.braindump.orchestrator.error.WorkflowException;
import com.braindump.orchestrator.model.FindingSeverity;
import com.braindump.orchestrator.model.FindingStatus;
import com.braindump.orchestrator.service.FindingFilter;
import com.braindump.orchestrator.service.NewFinding;
import com.braindump.orchestrator.service.ReviewGateService;
import com.braindump.orchestrator.service.result.ReviewCompletionStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * REST API for AI review and the human review gate.
 *
 * POST /tickets/{id}/findings       submit a finding
 * GET  /tickets/{id}/findings       list findings (?status=open&severity=major&agent=...)
 * POST /findings/{id}/fix           mark a finding fixed
 * GET  /tickets/{id}/review-status  open findings per severity, and whether the gate is open
 * POST /tickets/{id}/demo           generate the demo script (moves the ticket to human_review)
 * GET  /tickets/{id}/demo           fetch the demo script
 */
@RestController
public class ReviewController {

    private final ReviewGateService reviewGate;

    public ReviewController(ReviewGateService reviewGate) {
        this.reviewGate = reviewGate;
    }

    @PostMapping("/tickets/{id}/findings")
    public ResponseEntity<FindingResponse> submitFinding(@PathVariable UUID id,
                                                         @RequestBody SubmitFindingRequest req) {
        var finding = reviewGate.submitFinding(new NewFinding(id, req.agent(), req.severity(),
                req.category(), req.description(), req.filePath(), req.lineNumber(), req.suggestedFix()));
        return ResponseEntity.status(HttpStatus.CREATED).body(FindingResponse.from(finding));
    }

    @GetMapping("/tickets/{id}/findings")
    public List<FindingResponse> getFindings(@PathVariable UUID id,
                                             @RequestParam(required = false) String status,
                                             @RequestParam(required = false) String severity,
                                             @RequestParam(required = false) String agent) {
        FindingFilter filter = new FindingFilter(
                status != null ? parse(() -> FindingStatus.fromValue(status)) : null,
                severity != null ? parse(() -> FindingSeverity.fromValue(severity)) : null,
                agent);
        return reviewGate.getFindings(id, filter).stream().map(FindingResponse::from).toList();
    }

    @PostMapping("/findings/{id}/fix")
    public FindingResponse markFixed(@PathVariable UUID id, @RequestBody MarkFixedRequest req) {
        return FindingResponse.from(reviewGate.markFixed(id, req.fixDescription()));
    }

    @GetMapping("/tickets/{id}/review-status")
    public ReviewCompletionStatus reviewStatus(@PathVariable UUID id) {
        return reviewGate.checkComplete(id);
    }

    @PostMapping("/tickets/{id}/demo")
    public ResponseEntity<DemoScriptResponse> generateDemo(@PathVariable UUID id,
                                                           @RequestBody GenerateDemoRequest req) {
        var demo = reviewGate.generateDemoScript(id, req.steps());
        return ResponseEntity.status(HttpStatus.CREATED).body(DemoScriptResponse.from(demo));
    }

    @GetMapping("/tickets/{id}/demo")
    public DemoScriptResponse getDemo(@PathVariable UUID id) {
        return reviewGate.getDemoScript(id)
                .map(DemoScriptResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No demo script for ticket " + id));
    }

    private static <T> T parse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw WorkflowException.validation(e.getMessage());
        }
    }
}
