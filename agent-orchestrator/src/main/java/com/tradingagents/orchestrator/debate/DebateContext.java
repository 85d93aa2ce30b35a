package com.tradingagents.orchestrator.debate;

import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.model.AnalystReport;
import com.tradingagents.common.model.Decision;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only inputs shared by every participant of one debate.
 *
 * @param traderDecision present for the risk debate, {@code null} for the research debate
 * @param situation      summary used as the memory retrieval key
 */
public record DebateContext(
    String symbol,
    LocalDate tradeDate,
    PipelineVariant variant,
    List<AnalystReport> reports,
    Decision traderDecision,
    String situation
) {
    public DebateContext {
        reports = reports == null ? List.of() : List.copyOf(reports);
        situation = situation == null ? "" : situation;
    }
}
