package com.tradingagents.orchestrator.synthesis;

import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.memory.MemoryScope;
import com.tradingagents.common.memory.ScoredMemory;
import com.tradingagents.common.model.Decision;
import com.tradingagents.common.model.DecisionStage;
import com.tradingagents.orchestrator.graph.TradingState;
import com.tradingagents.orchestrator.memory.MemoryBank;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns the research plan into a concrete transaction proposal.
 */
@Component
public class Trader extends AbstractDecisionSynthesizer {

    public Trader(LanguageModelClient model, DecisionParser parser,
                  MemoryBank memoryBank, PipelineConfig config) {
        super(model, parser, memoryBank, config);
    }

    @Override
    public DecisionStage stage() {
        return DecisionStage.TRADER;
    }

    @Override
    protected String agentName() {
        return "Trader";
    }

    @Override
    protected MemoryScope reflectionScope() {
        return MemoryScope.TRADER;
    }

    @Override
    protected List<MemoryScope> candidateScopes() {
        return List.of(MemoryScope.TRADER);
    }

    @Override
    protected String systemPrompt(TradingState state) {
        return "You are a trading agent analyzing market data to make investment decisions on the "
            + config.variant().assetNoun() + " " + state.symbol() + ". Based on the research plan and "
            + "the analyst reports, provide a specific recommendation to buy, sell or hold. Include in the "
            + "rationale the line 'FINAL TRANSACTION PROPOSAL: **BUY/HOLD/SELL**' to confirm your recommendation.";
    }

    @Override
    protected String userPrompt(TradingState state, List<ScoredMemory> reflections) {
        Decision plan = state.researchDecision();
        return "Trade date: " + state.tradeDate() + "\n\n"
            + "Proposed investment plan: " + plan.verdict() + "\n" + plan.rationale() + "\n\n"
            + SynthesisPrompts.reports(state) + "\n"
            + SynthesisPrompts.reflections(reflections) + "\n"
            + SynthesisPrompts.RESPONSE_FORMAT;
    }
}
