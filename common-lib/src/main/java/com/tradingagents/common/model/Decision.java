package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * Output of one decision stage.
 *
 * <p>{@code confidence} is clamped to [0.0, 1.0]. {@code metadata} carries stage-specific
 * detail such as the override record written by the risk manager.
 */
public record Decision(
    @JsonProperty("stage")      DecisionStage stage,
    @JsonProperty("verdict")    Verdict verdict,
    @JsonProperty("rationale")  String rationale,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("metadata")   Map<String, Object> metadata,
    @JsonProperty("degraded")   boolean degraded
) {
    public Decision {
        verdict = verdict == null ? Verdict.HOLD : verdict;
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Degraded HOLD used when a stage could not synthesize anything. */
    public static Decision unavailable(DecisionStage stage, String reason) {
        return new Decision(stage, Verdict.HOLD,
            "Synthesis unavailable for " + stage + ": " + reason, 0.0,
            Map.of("synthesisFailure", reason), true);
    }

    public Decision withVerdict(Verdict newVerdict, String newRationale, Map<String, Object> extraMetadata) {
        Map<String, Object> merged = new HashMap<>(metadata);
        if (extraMetadata != null) merged.putAll(extraMetadata);
        return new Decision(stage, newVerdict, newRationale, confidence, merged, degraded);
    }
}
