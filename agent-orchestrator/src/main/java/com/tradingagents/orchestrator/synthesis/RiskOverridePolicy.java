package com.tradingagents.orchestrator.synthesis;

import com.tradingagents.common.config.RiskPolicySettings;
import com.tradingagents.common.model.AnalystReport;
import com.tradingagents.common.model.Decision;
import com.tradingagents.common.model.DebateTurn;
import com.tradingagents.common.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic guardrail applied to the risk manager's verdict.
 *
 * <ol>
 *   <li>Insufficient evidence: every analyst report degraded → HOLD.</li>
 *   <li>Keyword override: trader proposed BUY or SELL and a risk-debate turn mentions one of
 *       the override keywords (case-insensitive) → HOLD.</li>
 * </ol>
 *
 * <p>Every decision passing through is annotated with {@link #OVERRIDE_APPLIED},
 * {@link #OVERRIDE_REASON} and {@link #TRADER_PROPOSAL}.
 */
public class RiskOverridePolicy {

    private static final Logger log = LoggerFactory.getLogger(RiskOverridePolicy.class);

    public static final String OVERRIDE_APPLIED = "overrideApplied";
    public static final String OVERRIDE_REASON  = "overrideReason";
    public static final String TRADER_PROPOSAL  = "traderProposal";

    private final RiskPolicySettings settings;

    public RiskOverridePolicy(RiskPolicySettings settings) {
        this.settings = settings;
    }

    public Decision apply(Decision proposed, Decision traderDecision,
                          Collection<AnalystReport> reports, List<DebateTurn> riskTurns) {
        Verdict traderVerdict = traderDecision == null ? Verdict.HOLD : traderDecision.verdict();
        Map<String, Object> meta = new HashMap<>();
        meta.put(TRADER_PROPOSAL, traderVerdict.name());

        if (settings.holdOnInsufficientEvidence() && !reports.isEmpty()
                && reports.stream().allMatch(AnalystReport::degraded)) {
            String reason = "insufficient evidence: all " + reports.size() + " analyst reports were degraded";
            return override(proposed, meta, reason);
        }

        if (traderVerdict.isDirectional()) {
            for (DebateTurn turn : riskTurns) {
                String text = turn.text().toLowerCase(Locale.ROOT);
                for (String keyword : settings.overrideKeywords()) {
                    if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
                        String reason = "risk override: " + turn.role().displayName() + " flagged '" + keyword
                            + "' against the trader's " + traderVerdict + " proposal";
                        return override(proposed, meta, reason);
                    }
                }
            }
        }

        meta.put(OVERRIDE_APPLIED, false);
        meta.put(OVERRIDE_REASON, "");
        return proposed.withVerdict(proposed.verdict(), proposed.rationale(), meta);
    }

    private Decision override(Decision proposed, Map<String, Object> meta, String reason) {
        log.info("[RiskOverridePolicy] Forcing HOLD. proposed={} reason={}", proposed.verdict(), reason);
        meta.put(OVERRIDE_APPLIED, true);
        meta.put(OVERRIDE_REASON, reason);
        String rationale = "HOLD (" + reason + "). Risk manager's assessment: " + proposed.rationale();
        return proposed.withVerdict(Verdict.HOLD, rationale, meta);
    }
}
