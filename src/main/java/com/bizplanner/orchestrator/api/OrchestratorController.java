package com.bizplanner.orchestrator.api;

import com.bizplanner.orchestrator.engine.Orchestrator;
import com.bizplanner.orchestrator.exception.OrchestratorException;
import com.bizplanner.orchestrator.model.orchestration.OrchestrationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form orchestration: intent resolution, agent execution and synthesis
 * for a message outside the questionnaire flow.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orchestrator")
@RequiredArgsConstructor
public class OrchestratorController {

    private final Orchestrator orchestrator;

    @PostMapping
    public ResponseEntity<OrchestratorResponse> process(@RequestBody OrchestratorRequest request) {
        log.info("📥 Orchestration request: {}", request.getMessage());

        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return ResponseEntity.badRequest()
                .body(OrchestratorResponse.error("INVALID_REQUEST", "Message is required"));
        }

        try {
            Map<String, Object> context = request.getContext() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(request.getContext());
            OrchestrationResult result = orchestrator.processRequest(request.getMessage(), context);

            log.info("✅ Orchestration completed in {}ms", result.getExecutionTimeMs());
            return ResponseEntity.ok(OrchestratorResponse.success(result));

        } catch (OrchestratorException e) {
            log.error("Orchestration failed [{}]", e.getCode(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(OrchestratorResponse.error(e.getCode().name(), e.getMessage()));

        } catch (Exception e) {
            log.error("Failed to process orchestration request", e);
            return ResponseEntity.internalServerError()
                .body(OrchestratorResponse.error("INTERNAL_ERROR", "Internal error: " + e.getMessage()));
        }
    }
}
