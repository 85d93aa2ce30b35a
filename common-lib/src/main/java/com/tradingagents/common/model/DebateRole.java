package com.tradingagents.common.model;

/**
 * Participants of the two adversarial debates.
 * BULL/BEAR argue the research case; RISKY/SAFE/NEUTRAL argue the risk posture
 * of the trader's proposal.
 */
public enum DebateRole {

    BULL("Bull Researcher",
        "Build a strong, evidence-based case FOR investing: growth potential, competitive "
            + "advantages, positive indicators. Directly counter the bear's latest points."),
    BEAR("Bear Researcher",
        "Build a strong, evidence-based case AGAINST investing: risks, weaknesses, negative "
            + "indicators. Directly counter the bull's latest points."),
    RISKY("Aggressive Risk Analyst",
        "Champion high-reward opportunities in the trader's plan. Argue why bold sizing is "
            + "justified and where the cautious views miss upside."),
    SAFE("Conservative Risk Analyst",
        "Protect capital. Stress volatility, liquidity and downside scenarios in the trader's "
            + "plan and argue for tighter exposure."),
    NEUTRAL("Neutral Risk Analyst",
        "Weigh both the aggressive and conservative views and argue for a balanced, "
            + "sustainable position.");

    private final String displayName;
    private final String stance;

    DebateRole(String displayName, String stance) {
        this.displayName = displayName;
        this.stance = stance;
    }

    public String displayName() { return displayName; }

    public String stance() { return stance; }
}
