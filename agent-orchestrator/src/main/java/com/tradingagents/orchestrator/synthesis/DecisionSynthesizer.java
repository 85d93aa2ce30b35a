package com.tradingagents.orchestrator.synthesis;

import com.tradingagents.common.model.Decision;
import com.tradingagents.common.model.DecisionStage;
import com.tradingagents.orchestrator.graph.TradingState;
import reactor.core.publisher.Mono;

public interface DecisionSynthesizer {

    DecisionStage stage();

    /**
     * Reads the inputs this stage needs from {@code state} and emits its decision.
     * Implementations record a memory candidate on the state for every decision they synthesize.
     */
    Mono<Decision> synthesize(TradingState state);
}
