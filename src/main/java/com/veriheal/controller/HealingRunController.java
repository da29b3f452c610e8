package com.veriheal.controller;

import com.veriheal.controller.dto.ResolutionRequest;
import com.veriheal.controller.dto.RunRequest;
import com.veriheal.core.checklist.ChecklistStoreException;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.escalation.EscalationController;
import com.veriheal.core.escalation.EscalationTicket;
import com.veriheal.core.escalation.Verdict;
import com.veriheal.orchestrator.HealingOrchestrator;
import com.veriheal.orchestrator.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/runs")
public class HealingRunController {

    private static final Logger log = LoggerFactory.getLogger(HealingRunController.class);

    private final HealingOrchestrator  orchestrator;
    private final EscalationController escalations;

    public HealingRunController(HealingOrchestrator orchestrator, EscalationController escalations) {
        this.orchestrator = orchestrator;
        this.escalations  = escalations;
    }

    /**
     * Runs a batch to completion and returns its summary.
     */
    @PostMapping
    public ResponseEntity<RunSummary> run(@RequestBody RunRequest request) throws ChecklistStoreException {
        if (request.getCases() == null || request.getCases().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        RunSummary summary = request.getRunId() != null
                ? orchestrator.runOnce(request.getRunId(), request.getCases())
                : orchestrator.runOnce(request.getCases());
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/{runId}/resume")
    public ResponseEntity<RunSummary> resume(@PathVariable String runId) throws ChecklistStoreException {
        return ResponseEntity.ok(orchestrator.resume(runId));
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String runId) {
        boolean accepted = orchestrator.cancel(runId);
        HttpStatus status = accepted ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of("runId", runId, "cancelled", accepted));
    }

    @GetMapping("/{runId}/escalations")
    public ResponseEntity<List<EscalationTicket>> escalations(@PathVariable String runId)
            throws ChecklistStoreException {
        return ResponseEntity.ok(escalations.pending(runId));
    }

    @PostMapping("/{runId}/escalations/{caseId}")
    public ResponseEntity<TestCase> resolve(
            @PathVariable String runId,
            @PathVariable String caseId,
            @RequestBody ResolutionRequest request
    ) throws ChecklistStoreException {
        Verdict verdict = Verdict.parse(request.getVerdict());
        TestCase resolved = escalations.resolve(runId, caseId, verdict, request.getPatch(), request.getNote());
        return ResponseEntity.ok(resolved);
    }

    // =========================================================================
    // ERROR MAPPING
    // =========================================================================

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ChecklistStoreException.class)
    public ResponseEntity<Map<String, String>> storeFailure(ChecklistStoreException e) {
        log.error("[API] Checklist store failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }
}
