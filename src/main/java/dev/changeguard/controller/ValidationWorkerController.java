package dev.changeguard.controller;

import dev.changeguard.domain.valueobject.Verdict;
import dev.changeguard.dto.request.ValidationTaskMessage;
import dev.changeguard.orchestrator.ValidationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Push-queue entry point. A 2xx tells the queue the task is done; any failure maps to a
 * non-2xx through {@code GlobalExceptionHandler} so the queue redelivers it.
 */
@RestController
@RequestMapping("/workers")
public class ValidationWorkerController {
    private static final Logger log = LoggerFactory.getLogger(ValidationWorkerController.class);
    private final ValidationOrchestrator orchestrator;

    public ValidationWorkerController(ValidationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/change-validation")
    public ResponseEntity<Map<String, Object>> process(@RequestBody ValidationTaskMessage task) {
        if (!task.isValid()) throw new IllegalArgumentException("changeId is required");
        log.info("Worker task for change {} ({})", task.changeNumber(), task.changeId());
        Verdict verdict = orchestrator.process(task.changeId());
        return ResponseEntity.ok(Map.of(
                "status", "completed",
                "change_sys_id", task.changeId(),
                "overall_status", verdict.overallStatus().name()));
    }
}
