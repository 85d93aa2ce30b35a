package com.tradingagents.common.model;

import java.util.Locale;

/**
 * Domains covered by the data-gathering analysts.
 * The {@code key} is the value accepted in {@code pipeline.enabled-analysts}.
 */
public enum AnalystKind {

    MARKET("market", "Market Analyst"),
    ONCHAIN("onchain", "On-Chain Analyst"),
    NEWS("news", "News Analyst"),
    SOCIAL("social", "Social Sentiment Analyst");

    private final String key;
    private final String displayName;

    AnalystKind(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() { return key; }

    public String displayName() { return displayName; }

    /**
     * Resolves a configuration key to its analyst kind.
     *
     * @throws IllegalArgumentException for unknown keys
     */
    public static AnalystKind fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (AnalystKind kind : values()) {
            if (kind.key.equals(normalized)) return kind;
        }
        throw new IllegalArgumentException("Unknown analyst kind: " + key);
    }
}
