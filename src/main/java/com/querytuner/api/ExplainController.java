package com.querytuner.api;

import com.querytuner.model.explain.ExplainConfig;
import com.querytuner.service.ExplainService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for running diagnostics and inspecting the engine.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ExplainController {

    private final ExplainService explainService;

    /**
     * Run diagnostics for a query edit.
     *
     * POST /api/v1/query/explain
     */
    @PostMapping("/query/explain")
    public ResponseEntity<ExplainResponse> explain(@Valid @RequestBody ExplainRequest request) {
        log.debug("Explain request on branch {} (parent={})", request.getBranchId(), request.getParentVersionId());
        return ResponseEntity.ok(explainService.explain(request));
    }

    @GetMapping("/explain/configs")
    public ResponseEntity<List<ExplainConfig>> getDefaultConfigs() {
        return ResponseEntity.ok(explainService.getDefaultConfigs());
    }

    @GetMapping("/server/settings")
    public ResponseEntity<Map<String, String>> getServerSettings() {
        return ResponseEntity.ok(explainService.getServerSettings());
    }

    @GetMapping("/server/ping")
    public ResponseEntity<PingResponse> ping() {
        return ResponseEntity.ok(explainService.ping());
    }
}
