package com.tradingagents.orchestrator.controller;

import com.tradingagents.common.exception.ConfigurationException;
import com.tradingagents.common.exception.PipelineAbortedException;
import com.tradingagents.common.exception.PipelineCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps pipeline exceptions onto HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> badConfiguration(ConfigurationException e) {
        log.warn("[Api] Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(RunNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(PipelineCancelledException.class)
    public ResponseEntity<Map<String, Object>> cancelled(PipelineCancelledException e) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", e.getMessage());
        body.put("runId", e.getRunId());
        body.put("trace", e.getPartialTrace());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(PipelineAbortedException.class)
    public ResponseEntity<Map<String, Object>> aborted(PipelineAbortedException e) {
        log.error("[Api] Run aborted. runId={} stage={}", e.getRunId(), e.getFailedStage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", e.getMessage());
        body.put("runId", e.getRunId());
        body.put("failedStage", e.getFailedStage());
        body.put("trace", e.getPartialTrace());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
