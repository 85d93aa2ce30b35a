package com.tradingagents.common.model;

import java.util.Locale;

/**
 * Categorical trading action emitted by every decision stage.
 * No other value is ever produced by the pipeline.
 */
public enum Verdict {

    BUY,
    SELL,
    HOLD;

    /**
     * Lenient parse of a model-provided verdict string.
     * Anything outside BUY/SELL/HOLD (including WATCH, blanks and nulls) resolves to HOLD.
     */
    public static Verdict parse(String raw) {
        if (raw == null) return HOLD;
        String normalized = raw.replace("*", "").trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "BUY"  -> BUY;
            case "SELL" -> SELL;
            default     -> HOLD;
        };
    }

    /** True for verdicts that open or close a position. */
    public boolean isDirectional() {
        return this != HOLD;
    }
}
