package com.tradingagents.orchestrator.synthesis;

import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.memory.MemoryScope;
import com.tradingagents.common.memory.ScoredMemory;
import com.tradingagents.common.model.DecisionStage;
import com.tradingagents.orchestrator.graph.TradingState;
import com.tradingagents.orchestrator.memory.MemoryBank;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Judges the bull/bear debate and commits to an investment stance.
 */
@Component
public class ResearchManager extends AbstractDecisionSynthesizer {

    public ResearchManager(LanguageModelClient model, DecisionParser parser,
                           MemoryBank memoryBank, PipelineConfig config) {
        super(model, parser, memoryBank, config);
    }

    @Override
    public DecisionStage stage() {
        return DecisionStage.RESEARCH_MANAGER;
    }

    @Override
    protected String agentName() {
        return "Research Manager";
    }

    @Override
    protected MemoryScope reflectionScope() {
        return MemoryScope.RESEARCH_MANAGER;
    }

    @Override
    protected List<MemoryScope> candidateScopes() {
        return List.of(MemoryScope.RESEARCH_MANAGER, MemoryScope.RESEARCH_DEBATE);
    }

    @Override
    protected String systemPrompt(TradingState state) {
        return "As the portfolio manager and debate facilitator, critically evaluate the debate between "
            + "the bull and bear analysts on the " + config.variant().assetNoun() + " " + state.symbol()
            + " and make a definitive decision. Commit to BUY or SELL when the strongest arguments warrant it; "
            + "choose HOLD only when it is genuinely justified, not as a fallback when both sides have valid points.";
    }

    @Override
    protected String userPrompt(TradingState state, List<ScoredMemory> reflections) {
        return "Trade date: " + state.tradeDate() + "\n\n"
            + SynthesisPrompts.reports(state) + "\n"
            + "Debate history:\n" + state.researchDebate().render() + "\n\n"
            + SynthesisPrompts.reflections(reflections) + "\n"
            + SynthesisPrompts.RESPONSE_FORMAT;
    }
}
