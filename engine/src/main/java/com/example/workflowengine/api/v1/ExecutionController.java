package com.example.workflowengine.api.v1;

import com.example.workflowengine.api.v1.dto.CancelExecutionResponse;
import com.example.workflowengine.api.v1.dto.ExecutionListResponse;
import com.example.workflowengine.api.v1.dto.ExecutionResponse;
import com.example.workflowengine.service.WorkflowRunService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for execution records kept by the engine.
 */
@RestController
@RequestMapping("/api/v1/executions")
@RequiredArgsConstructor
@Slf4j
public class ExecutionController {

    private final WorkflowRunService runService;

    @GetMapping
    public ResponseEntity<ExecutionListResponse> list(@RequestParam(required = false) String workflowId) {
        log.debug("Listing executions workflowId={}", workflowId);
        return ResponseEntity.ok(new ExecutionListResponse(runService.listExecutions(workflowId).stream()
                .map(ExecutionResponse::from)
                .toList()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExecutionResponse> getById(@PathVariable String id) {
        log.debug("Getting execution id={}", id);
        return ResponseEntity.ok(ExecutionResponse.from(runService.getExecution(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CancelExecutionResponse> cancel(@PathVariable String id) {
        log.info("Cancelling execution id={}", id);
        return ResponseEntity.ok(new CancelExecutionResponse(id, runService.cancelExecution(id)));
    }
}
