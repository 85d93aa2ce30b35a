package com.tradingagents.orchestrator.controller;

import com.tradingagents.common.model.FinalDecision;
import com.tradingagents.orchestrator.graph.GraphOrchestrator;
import com.tradingagents.orchestrator.graph.RunRegistry;
import com.tradingagents.orchestrator.graph.TradingState;
import com.tradingagents.orchestrator.memory.ReflectionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/trading")
public class TradingController {

    private final GraphOrchestrator orchestrator;
    private final RunRegistry runRegistry;
    private final ReflectionService reflectionService;

    public TradingController(GraphOrchestrator orchestrator, RunRegistry runRegistry,
                             ReflectionService reflectionService) {
        this.orchestrator = orchestrator;
        this.runRegistry = runRegistry;
        this.reflectionService = reflectionService;
    }

    /** Runs the full pipeline and answers with the final decision. */
    @PostMapping("/decide")
    public Mono<ResponseEntity<FinalDecision>> decide(@RequestBody DecideRequest request) {
        return orchestrator.run(request.symbol(), request.date()).map(ResponseEntity::ok);
    }

    /** Starts a background run; poll {@code GET /runs/{runId}} for progress. */
    @PostMapping("/runs")
    public ResponseEntity<RunStatusResponse> start(@RequestBody DecideRequest request) {
        TradingState state = orchestrator.start(request.symbol(), request.date());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new RunStatusResponse(state.runId(), state.stage(), state.trace()));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunStatusResponse> status(@PathVariable String runId) {
        TradingState state = runRegistry.find(runId).orElseThrow(() -> new RunNotFoundException(runId));
        return ResponseEntity.ok(new RunStatusResponse(runId, state.stage(), state.trace()));
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String runId) {
        if (runRegistry.find(runId).isEmpty()) {
            throw new RunNotFoundException(runId);
        }
        boolean accepted = orchestrator.cancel(runId);
        return ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT)
            .body(Map.of("runId", runId, "cancelRequested", accepted));
    }

    /** Writes reflections for a completed run into memory. */
    @PostMapping("/runs/{runId}/outcome")
    public Mono<ResponseEntity<Map<String, Object>>> outcome(@PathVariable String runId,
                                                             @RequestBody OutcomeRequest request) {
        TradingState state = runRegistry.find(runId).orElseThrow(() -> new RunNotFoundException(runId));
        return Mono.fromCallable(() -> reflectionService.recordOutcome(state, request.outcome(), request.notes()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(records -> ResponseEntity.ok(Map.<String, Object>of("runId", runId, "reflectionsWritten", records.size())));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
