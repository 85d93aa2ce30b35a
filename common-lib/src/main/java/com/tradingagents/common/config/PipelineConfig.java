package com.tradingagents.common.config;

import com.tradingagents.common.exception.ConfigurationException;
import com.tradingagents.common.model.AnalystKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Process-wide pipeline configuration. Built once before the first run and passed by
 * reference into every component that needs it; never mutated afterwards.
 */
public record PipelineConfig(
    int maxDebateRounds,
    int maxRiskDiscussRounds,
    boolean onlineTools,
    Set<AnalystKind> enabledAnalysts,
    Set<String> supportedTokens,
    PipelineVariant variant,
    int memoryTopK,
    int maxToolCallsPerReport,
    Duration generationTimeout,
    Duration toolTimeout,
    RiskPolicySettings riskPolicy
) {
    public PipelineConfig {
        enabledAnalysts = enabledAnalysts == null || enabledAnalysts.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(enabledAnalysts));
        supportedTokens = supportedTokens == null ? Set.of() : normalizeTokens(supportedTokens);
        riskPolicy = riskPolicy == null ? RiskPolicySettings.defaults() : riskPolicy;
    }

    /** Defaults mirroring the crypto deployment: two rounds per debate, all four analysts. */
    public static PipelineConfig defaults() {
        return new PipelineConfig(2, 2, true,
            PipelineVariant.CRYPTO.supportedAnalysts(),
            Set.of("BTC", "ETH", "SOL", "MATIC", "AVAX", "BNB", "ADA", "DOT", "LINK", "UNI"),
            PipelineVariant.CRYPTO, 2, 6,
            Duration.ofSeconds(60), Duration.ofSeconds(20),
            RiskPolicySettings.defaults());
    }

    /**
     * Checks every option and returns {@code this} for chaining.
     *
     * @throws ConfigurationException listing every problem found
     */
    public PipelineConfig validate() {
        List<String> problems = new ArrayList<>();
        if (maxDebateRounds < 1) problems.add("max-debate-rounds must be >= 1 (was " + maxDebateRounds + ")");
        if (maxRiskDiscussRounds < 1) problems.add("max-risk-discuss-rounds must be >= 1 (was " + maxRiskDiscussRounds + ")");
        if (enabledAnalysts.isEmpty()) problems.add("enabled-analysts must name at least one analyst");
        if (supportedTokens.isEmpty()) problems.add("supported-tokens must not be empty");
        if (variant == null) {
            problems.add("variant is required");
        } else {
            Set<AnalystKind> unsupported = EnumSet.noneOf(AnalystKind.class);
            unsupported.addAll(enabledAnalysts);
            unsupported.removeAll(variant.supportedAnalysts());
            if (!unsupported.isEmpty()) {
                problems.add("analysts " + unsupported + " are not available in variant " + variant);
            }
        }
        if (memoryTopK < 0) problems.add("memory-top-k must be >= 0 (was " + memoryTopK + ")");
        if (maxToolCallsPerReport < 0) problems.add("max-tool-calls-per-report must be >= 0");
        if (isNotPositive(generationTimeout)) problems.add("generation-timeout must be positive");
        if (isNotPositive(toolTimeout)) problems.add("tool-timeout must be positive");

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid pipeline configuration: " + String.join("; ", problems));
        }
        return this;
    }

    /**
     * Ensures the symbol is one this deployment trades.
     *
     * @return the normalized (upper-case) symbol
     * @throws ConfigurationException for blank or unsupported symbols
     */
    public String requireSupported(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ConfigurationException("Asset symbol is required");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (!supportedTokens.contains(normalized)) {
            throw new ConfigurationException("Asset " + normalized + " is not in supported-tokens " + supportedTokens);
        }
        return normalized;
    }

    public int roundsFor(boolean riskDebate) {
        return riskDebate ? maxRiskDiscussRounds : maxDebateRounds;
    }

    private static boolean isNotPositive(Duration d) {
        return d == null || d.isZero() || d.isNegative();
    }

    private static Set<String> normalizeTokens(Set<String> tokens) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String t : tokens) {
            if (t != null && !t.isBlank()) normalized.add(t.trim().toUpperCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(normalized);
    }
}
