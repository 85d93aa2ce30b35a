package com.tradingagents.orchestrator.synthesis;

import com.tradingagents.common.memory.ScoredMemory;
import com.tradingagents.common.model.AnalystReport;
import com.tradingagents.orchestrator.graph.TradingState;

import java.util.List;

final class SynthesisPrompts {

    static final String RESPONSE_FORMAT = """
        Respond with ONLY valid JSON, no markdown:
        {"verdict": "BUY|SELL|HOLD", "confidence": <0.0-1.0>, "rationale": "<concise reasoning>"}
        """;

    private SynthesisPrompts() {}

    static String reports(TradingState state) {
        StringBuilder sb = new StringBuilder("Analyst reports:\n");
        for (AnalystReport report : state.reports()) {
            sb.append("--- ").append(report.kind().displayName());
            if (report.degraded()) sb.append(" (degraded)");
            sb.append(" ---\n").append(report.text()).append('\n');
        }
        return sb.toString();
    }

    static String reflections(List<ScoredMemory> reflections) {
        if (reflections.isEmpty()) return "Past reflections: (none)\n";
        StringBuilder sb = new StringBuilder("Past reflections from similar situations (learn from these mistakes):\n");
        for (ScoredMemory m : reflections) {
            sb.append("  - ").append(m.record().reflection()).append('\n');
        }
        return sb.toString();
    }
}
