package com.tradingagents.orchestrator.graph;

import com.tradingagents.analysis.service.AnalystDispatchService;
import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.exception.ConfigurationException;
import com.tradingagents.common.exception.PipelineAbortedException;
import com.tradingagents.common.exception.PipelineCancelledException;
import com.tradingagents.common.memory.MemoryScope;
import com.tradingagents.common.model.Decision;
import com.tradingagents.common.model.FinalDecision;
import com.tradingagents.common.model.PipelineStage;
import com.tradingagents.common.trace.TraceContextUtil;
import com.tradingagents.orchestrator.debate.DebateContext;
import com.tradingagents.orchestrator.debate.DebateController;
import com.tradingagents.orchestrator.debate.DebateTranscript;
import com.tradingagents.orchestrator.debate.TranscriptStatus;
import com.tradingagents.orchestrator.logger.PipelineFlowLogger;
import com.tradingagents.orchestrator.memory.MemoryBank;
import com.tradingagents.orchestrator.synthesis.ResearchManager;
import com.tradingagents.orchestrator.synthesis.RiskManager;
import com.tradingagents.orchestrator.synthesis.Trader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives one run through the fixed stage graph:
 *
 * <pre>
 * CREATED → COLLECTING_ANALYSTS → RESEARCH_DEBATE → RESEARCH_DECISION
 *         → TRADER_DECISION → RISK_DEBATE → FINAL_DECISION → COMPLETE
 * </pre>
 *
 * <p>Analysts run in parallel and all settle before the research debate starts; every later
 * stage is sequential. Cancellation is observed between stages and between debate turns, and
 * is refused once the final decision stage has begun. A
 * failure that leaves no final decision reachable ends the run {@code ABORTED} with a
 * {@link PipelineAbortedException} carrying the partial trace.
 */
@Service
public class GraphOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GraphOrchestrator.class);

    private final PipelineConfig config;
    private final AnalystDispatchService analysts;
    private final CapabilityRegistry capabilities;
    private final DebateController debates;
    private final ResearchManager researchManager;
    private final Trader trader;
    private final RiskManager riskManager;
    private final MemoryBank memoryBank;
    private final RunRegistry runRegistry;
    private final PipelineFlowLogger flowLogger;

    public GraphOrchestrator(PipelineConfig config, AnalystDispatchService analysts,
                             CapabilityRegistry capabilities, DebateController debates,
                             ResearchManager researchManager, Trader trader, RiskManager riskManager,
                             MemoryBank memoryBank, RunRegistry runRegistry, PipelineFlowLogger flowLogger) {
        this.config = config.validate();
        this.analysts = analysts;
        this.capabilities = capabilities;
        this.debates = debates;
        this.researchManager = researchManager;
        this.trader = trader;
        this.riskManager = riskManager;
        this.memoryBank = memoryBank;
        this.runRegistry = runRegistry;
        this.flowLogger = flowLogger;
    }

    /**
     * Runs the whole graph and emits the final decision.
     * Errors with {@link ConfigurationException} before any stage for unsupported input.
     */
    public Mono<FinalDecision> run(String symbol, LocalDate tradeDate) {
        return Mono.defer(() -> execute(open(symbol, tradeDate)));
    }

    /**
     * Starts a run in the background and returns its state immediately.
     *
     * @throws ConfigurationException for unsupported input, before the run is registered
     */
    public TradingState start(String symbol, LocalDate tradeDate) {
        TradingState state = open(symbol, tradeDate);
        execute(state).subscribe(
            decision -> log.info("[GraphOrchestrator] Background run complete. runId={} verdict={}",
                decision.runId(), decision.verdict()),
            error -> log.warn("[GraphOrchestrator] Background run ended without decision. runId={} stage={} reason={}",
                state.runId(), state.stage(), error.getMessage()));
        return state;
    }

    /** @return false for unknown or already finished runs */
    public boolean cancel(String runId) {
        boolean accepted = runRegistry.find(runId).map(TradingState::requestCancel).orElse(false);
        log.info("[GraphOrchestrator] Cancel requested. runId={} accepted={}", runId, accepted);
        return accepted;
    }

    private TradingState open(String symbol, LocalDate tradeDate) {
        String normalized = config.requireSupported(symbol);
        if (tradeDate == null) {
            throw new ConfigurationException("Trade date is required");
        }
        TradingState state = new TradingState(UUID.randomUUID().toString(), normalized, tradeDate);
        runRegistry.register(state);
        log.info("[GraphOrchestrator] Run created. runId={} symbol={} date={} analysts={} onlineTools={}",
            state.runId(), normalized, tradeDate, config.enabledAnalysts(), config.onlineTools());
        return state;
    }

    private Mono<FinalDecision> execute(TradingState state) {
        Mono<FinalDecision> pipeline =
            step(state, PipelineStage.COLLECTING_ANALYSTS, () -> collectAnalysts(state))
                .then(step(state, PipelineStage.RESEARCH_DEBATE, () -> researchDebate(state)))
                .then(step(state, PipelineStage.RESEARCH_DECISION, () ->
                    researchManager.synthesize(state).doOnNext(state::setResearchDecision).then()))
                .then(step(state, PipelineStage.TRADER_DECISION, () ->
                    trader.synthesize(state).doOnNext(state::setTraderDecision).then()))
                .then(step(state, PipelineStage.RISK_DEBATE, () -> riskDebate(state)))
                .then(step(state, PipelineStage.FINAL_DECISION, () ->
                    riskManager.synthesize(state).doOnNext(state::setFinalDecision).then()))
                .then(Mono.defer(() -> state.isCancelRequested()
                    ? Mono.<FinalDecision>error(cancelled(state))
                    : Mono.fromSupplier(() -> complete(state))))
                .doOnEach(flowLogger.stage(PipelineStage.COMPLETE))
                .onErrorMap(e -> !(e instanceof PipelineCancelledException), e -> abort(state, e));

        return TraceContextUtil.withRunId(pipeline, state.runId());
    }

    private Mono<Void> step(TradingState state, PipelineStage stage, Supplier<Mono<Void>> work) {
        return Mono.defer(() -> {
            if (state.isCancelRequested()) {
                return Mono.error(cancelled(state));
            }
            transition(state, stage);
            return work.get();
        });
    }

    private Mono<Void> collectAnalysts(TradingState state) {
        Set<String> enabledTools = config.onlineTools() ? capabilities.names() : Set.of();
        return analysts.dispatchAll(state.symbol(), state.tradeDate(), config.enabledAnalysts(), enabledTools)
            .doOnNext(state::putReports)
            .then();
    }

    private Mono<Void> researchDebate(TradingState state) {
        return debates.run(DebateController.RESEARCH_ROLES, config.roundsFor(false), debateContext(state, null),
                memoryBank.store(MemoryScope.RESEARCH_DEBATE), state::isCancelRequested)
            .doOnNext(state::setResearchDebate)
            .flatMap(transcript -> endIfCancelled(state, transcript));
    }

    private Mono<Void> riskDebate(TradingState state) {
        return debates.run(DebateController.RISK_ROLES, config.roundsFor(true),
                debateContext(state, state.traderDecision()),
                memoryBank.store(MemoryScope.RISK_DEBATE), state::isCancelRequested)
            .doOnNext(state::setRiskDebate)
            .flatMap(transcript -> endIfCancelled(state, transcript));
    }

    private Mono<Void> endIfCancelled(TradingState state, DebateTranscript transcript) {
        return transcript.status() == TranscriptStatus.CANCELLED
            ? Mono.error(cancelled(state))
            : Mono.empty();
    }

    private DebateContext debateContext(TradingState state, Decision traderDecision) {
        return new DebateContext(state.symbol(), state.tradeDate(), config.variant(),
            List.copyOf(state.reports()), traderDecision, state.situationSummary());
    }

    private FinalDecision complete(TradingState state) {
        transition(state, PipelineStage.COMPLETE);
        Decision decision = state.finalDecision();
        return new FinalDecision(state.runId(), decision.verdict(), decision.rationale(), state.trace());
    }

    private PipelineCancelledException cancelled(TradingState state) {
        transition(state, PipelineStage.CANCELLED);
        return new PipelineCancelledException(state.runId(), state.trace());
    }

    private PipelineAbortedException abort(TradingState state, Throwable e) {
        PipelineStage failedStage = state.stage();
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        state.fail(reason);
        transition(state, PipelineStage.ABORTED);
        log.error("[GraphOrchestrator] Run aborted. runId={} stage={} reason={}", state.runId(), failedStage, reason);
        return new PipelineAbortedException(state.runId(), failedStage, state.trace(), reason, e);
    }

    private void transition(TradingState state, PipelineStage next) {
        flowLogger.transition(state.runId(), state.stage(), next);
        state.advanceTo(next);
    }
}
