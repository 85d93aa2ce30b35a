package com.tradingagents.orchestrator.synthesis;

import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.exception.SynthesisException;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.llm.ModelRequest;
import com.tradingagents.common.llm.ModelTier;
import com.tradingagents.common.memory.MemoryScope;
import com.tradingagents.common.memory.ScoredMemory;
import com.tradingagents.common.model.Decision;
import com.tradingagents.common.model.MemoryCandidate;
import com.tradingagents.orchestrator.graph.TradingState;
import com.tradingagents.orchestrator.memory.MemoryBank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Common generate → parse → record flow for the three decision stages.
 *
 * <p>Subclasses supply prompts and the memory scopes they read from and write to. A stage
 * that cannot synthesize falls back through {@link #onFailure}; by default that is a
 * degraded HOLD. Only synthesized decisions leave memory candidates unless the fallback records
 * its own.
 */
public abstract class AbstractDecisionSynthesizer implements DecisionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(AbstractDecisionSynthesizer.class);

    private static final int MAX_DECISION_TOKENS = 1024;

    private final LanguageModelClient model;
    private final DecisionParser parser;
    private final MemoryBank memoryBank;
    protected final PipelineConfig config;

    protected AbstractDecisionSynthesizer(LanguageModelClient model, DecisionParser parser,
                                          MemoryBank memoryBank, PipelineConfig config) {
        this.model = model;
        this.parser = parser;
        this.memoryBank = memoryBank;
        this.config = config;
    }

    protected abstract String agentName();

    /** Scope whose reflections condition this stage. */
    protected abstract MemoryScope reflectionScope();

    /** Scopes that receive a memory candidate for each synthesized decision. */
    protected abstract List<MemoryScope> candidateScopes();

    protected abstract String systemPrompt(TradingState state);

    protected abstract String userPrompt(TradingState state, List<ScoredMemory> reflections);

    /** Hook applied to a successfully parsed decision. */
    protected Decision postProcess(TradingState state, Decision decision) {
        return decision;
    }

    /** Fallback when generation or parsing failed. */
    protected Mono<Decision> onFailure(TradingState state, Throwable error) {
        return Mono.just(Decision.unavailable(stage(), describe(error)));
    }

    /**
     * Prompt construction runs outside the fallback: a state that cannot be prompted from,
     * such as an unfinished debate transcript, fails the stage instead of degrading it.
     */
    @Override
    public final Mono<Decision> synthesize(TradingState state) {
        return Mono.defer(() -> {
            List<ScoredMemory> reflections = memoryBank.store(reflectionScope())
                .retrieve(state.situationSummary(), config.memoryTopK());
            ModelRequest request = ModelRequest.simple(agentName(), ModelTier.DEEP,
                systemPrompt(state), userPrompt(state, reflections), MAX_DECISION_TOKENS);

            return model.generate(request)
                .timeout(config.generationTimeout())
                .map(reply -> toDecision(reply.text()))
                .map(decision -> postProcess(state, decision))
                .doOnNext(decision -> recordCandidates(state, decision))
                .doOnNext(decision -> log.info("[{}] Decision synthesized. verdict={} confidence={} symbol={}",
                    agentName(), decision.verdict(), decision.confidence(), state.symbol()))
                .onErrorResume(e -> {
                    log.error("[{}] Synthesis failed. symbol={} reason={}", agentName(), state.symbol(), describe(e));
                    return onFailure(state, e);
                });
        });
    }

    private Decision toDecision(String text) {
        if (text == null || text.isBlank()) {
            throw new SynthesisException(agentName(), "model returned no decision text");
        }
        DecisionParser.ParsedDecision parsed = parser.parse(text);
        return new Decision(stage(), parsed.verdict(), parsed.rationale(), parsed.confidence(),
            Map.of("parsedFrom", parsed.source().name()), false);
    }

    /** Queues one candidate per {@link #candidateScopes()} entry for later reflection. */
    protected void recordCandidates(TradingState state, Decision decision) {
        String situation = state.situationSummary();
        for (MemoryScope scope : candidateScopes()) {
            state.addMemoryCandidate(new MemoryCandidate(scope, situation, decision.rationale(), decision.verdict()));
        }
    }

    protected static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
