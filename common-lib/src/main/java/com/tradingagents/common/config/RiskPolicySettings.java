package com.tradingagents.common.config;

import java.util.List;

/**
 * Settings for the risk manager's override behaviour.
 *
 * @param overrideKeywords           risk-debate phrases that force a directional proposal down to HOLD
 * @param holdOnInsufficientEvidence HOLD when every analyst report is degraded
 * @param fallbackToTrader           use the trader's proposal when risk synthesis fails
 */
public record RiskPolicySettings(
    List<String> overrideKeywords,
    boolean holdOnInsufficientEvidence,
    boolean fallbackToTrader
) {
    public RiskPolicySettings {
        overrideKeywords = overrideKeywords == null ? List.of() : List.copyOf(overrideKeywords);
    }

    public static RiskPolicySettings defaults() {
        return new RiskPolicySettings(List.of("liquidity risk"), true, true);
    }
}
