package com.tradingagents.orchestrator.debate;

import com.tradingagents.common.memory.ScoredMemory;
import com.tradingagents.common.model.AnalystReport;
import com.tradingagents.common.model.DebateRole;

import java.util.List;

final class DebatePrompts {

    private DebatePrompts() {}

    static String system(DebateRole role, DebateContext ctx) {
        return "You are the " + role.displayName() + " in a debate about trading the "
            + ctx.variant().assetNoun() + " " + ctx.symbol() + ". "
            + role.stance()
            + " Engage directly with the other participants' latest arguments in a conversational style,"
            + " without special formatting.";
    }

    static String user(DebateRole role, int round, DebateContext ctx, String transcript,
                       List<ScoredMemory> reflections) {
        StringBuilder sb = new StringBuilder();
        sb.append("Trade date: ").append(ctx.tradeDate()).append("\n\n");
        sb.append("Analyst reports:\n");
        for (AnalystReport report : ctx.reports()) {
            sb.append("--- ").append(report.kind().displayName()).append(" ---\n")
                .append(report.text()).append("\n");
        }
        if (ctx.traderDecision() != null) {
            sb.append("\nTrader's proposal: ").append(ctx.traderDecision().verdict())
                .append("\n").append(ctx.traderDecision().rationale()).append("\n");
        }
        sb.append("\nDebate so far:\n").append(transcript.isEmpty() ? "(you open the debate)" : transcript).append("\n");
        sb.append("\nReflections from similar past situations:\n");
        if (reflections.isEmpty()) {
            sb.append("(none)\n");
        } else {
            for (ScoredMemory m : reflections) {
                sb.append("- ").append(m.record().reflection()).append("\n");
            }
        }
        sb.append("\nThis is round ").append(round).append(". Give your argument as the ")
            .append(role.displayName()).append(".");
        return sb.toString();
    }
}
