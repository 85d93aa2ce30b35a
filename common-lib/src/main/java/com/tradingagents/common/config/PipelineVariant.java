package com.tradingagents.common.config;

import com.tradingagents.common.model.AnalystKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of pipeline flavours, selected once at construction time.
 * Each variant fixes the default analyst line-up and the wording used in prompts.
 */
public enum PipelineVariant {

    CRYPTO("cryptocurrency", "The cryptocurrency we want to analyze is %s",
        EnumSet.of(AnalystKind.MARKET, AnalystKind.ONCHAIN, AnalystKind.NEWS, AnalystKind.SOCIAL)),
    EQUITY("company", "The company we want to look at is %s",
        EnumSet.of(AnalystKind.MARKET, AnalystKind.NEWS, AnalystKind.SOCIAL));

    private final String assetNoun;
    private final String assetReferenceTemplate;
    private final Set<AnalystKind> supportedAnalysts;

    PipelineVariant(String assetNoun, String assetReferenceTemplate, Set<AnalystKind> supportedAnalysts) {
        this.assetNoun = assetNoun;
        this.assetReferenceTemplate = assetReferenceTemplate;
        this.supportedAnalysts = supportedAnalysts;
    }

    public String assetNoun() { return assetNoun; }

    public String assetReference(String symbol) {
        return assetReferenceTemplate.formatted(symbol);
    }

    public Set<AnalystKind> supportedAnalysts() {
        return EnumSet.copyOf(supportedAnalysts);
    }
}
