package com.tradingagents.analysis.agent;

import com.tradingagents.common.model.AnalystKind;
import com.tradingagents.common.model.AnalystReport;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public interface AnalystAgent {

    AnalystKind kind();

    String agentName();

    /** Capabilities this analyst would use for the given symbol, in preference order. */
    List<String> declaredCapabilities(String symbol);

    /**
     * Produces one report. Completes normally when data is unavailable (the report is
     * then degraded); errors only with a {@code SynthesisException} or a generation failure.
     *
     * @param enabledTools capabilities the run allows; empty for offline runs
     */
    Mono<AnalystReport> run(String symbol, LocalDate tradeDate, Set<String> enabledTools);
}
