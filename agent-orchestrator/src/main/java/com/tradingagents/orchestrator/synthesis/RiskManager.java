package com.tradingagents.orchestrator.synthesis;

import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.exception.SynthesisException;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.memory.MemoryScope;
import com.tradingagents.common.memory.ScoredMemory;
import com.tradingagents.common.model.Decision;
import com.tradingagents.common.model.DecisionStage;
import com.tradingagents.common.model.DebateTurn;
import com.tradingagents.orchestrator.graph.TradingState;
import com.tradingagents.orchestrator.memory.MemoryBank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Authoritative final stage: weighs the risk debate against the trader's proposal, then
 * passes the result through the {@link RiskOverridePolicy}.
 *
 * <p>When synthesis fails and {@code fallback-to-trader} is enabled, the trader's proposal
 * goes through the same policy instead and, being the run's final verdict, is recorded for
 * reflection; otherwise the failure propagates and the run aborts.
 */
@Component
public class RiskManager extends AbstractDecisionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final RiskOverridePolicy policy;

    public RiskManager(LanguageModelClient model, DecisionParser parser, MemoryBank memoryBank,
                       PipelineConfig config, RiskOverridePolicy policy) {
        super(model, parser, memoryBank, config);
        this.policy = policy;
    }

    @Override
    public DecisionStage stage() {
        return DecisionStage.RISK_MANAGER;
    }

    @Override
    protected String agentName() {
        return "Risk Manager";
    }

    @Override
    protected MemoryScope reflectionScope() {
        return MemoryScope.RISK_MANAGER;
    }

    @Override
    protected List<MemoryScope> candidateScopes() {
        return List.of(MemoryScope.RISK_MANAGER, MemoryScope.RISK_DEBATE);
    }

    @Override
    protected String systemPrompt(TradingState state) {
        return "As the risk management judge, evaluate the debate between the aggressive, conservative and "
            + "neutral risk analysts about the trader's plan for " + state.symbol() + ", and decide the final "
            + "action. Refine the trader's plan using the analysts' insights and lessons from past mistakes. "
            + "Choose HOLD only if strongly justified by specific arguments.";
    }

    @Override
    protected String userPrompt(TradingState state, List<ScoredMemory> reflections) {
        Decision trader = state.traderDecision();
        return "Trade date: " + state.tradeDate() + "\n\n"
            + "Trader's proposal: " + trader.verdict() + "\n" + trader.rationale() + "\n\n"
            + "Risk debate history:\n" + state.riskDebate().render() + "\n\n"
            + SynthesisPrompts.reflections(reflections) + "\n"
            + SynthesisPrompts.RESPONSE_FORMAT;
    }

    @Override
    protected Decision postProcess(TradingState state, Decision decision) {
        return policy.apply(decision, state.traderDecision(), state.reports(), riskTurns(state));
    }

    @Override
    protected Mono<Decision> onFailure(TradingState state, Throwable error) {
        Decision trader = state.traderDecision();
        if (!config.riskPolicy().fallbackToTrader() || trader == null) {
            return Mono.error(error instanceof SynthesisException
                ? error
                : new SynthesisException(agentName(), describe(error), error));
        }
        log.warn("[RiskManager] Falling back to trader proposal. verdict={} symbol={}", trader.verdict(), state.symbol());
        Decision fallback = new Decision(DecisionStage.RISK_MANAGER, trader.verdict(),
            "Risk synthesis unavailable (" + describe(error) + "); adopting trader proposal: " + trader.rationale(),
            trader.confidence(), Map.of("synthesisFailure", describe(error)), true);
        Decision decided = policy.apply(fallback, trader, state.reports(), riskTurns(state));
        recordCandidates(state, decided);
        return Mono.just(decided);
    }

    private static List<DebateTurn> riskTurns(TradingState state) {
        return state.riskDebate() == null ? List.of() : state.riskDebate().turns();
    }
}
