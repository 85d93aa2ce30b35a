package com.tradingagents.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.config.RiskPolicySettings;
import com.tradingagents.common.exception.ConfigurationException;
import com.tradingagents.common.memory.EmbeddingModel;
import com.tradingagents.common.memory.HashingEmbeddingModel;
import com.tradingagents.common.model.AnalystKind;
import com.tradingagents.orchestrator.synthesis.RiskOverridePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${pipeline.max-debate-rounds:2}")
    private int maxDebateRounds;

    @Value("${pipeline.max-risk-discuss-rounds:2}")
    private int maxRiskDiscussRounds;

    @Value("${pipeline.online-tools:true}")
    private boolean onlineTools;

    @Value("${pipeline.enabled-analysts:market,onchain,news,social}")
    private List<String> enabledAnalysts;

    @Value("${pipeline.supported-tokens:BTC,ETH,SOL,MATIC,AVAX,BNB,ADA,DOT,LINK,UNI}")
    private List<String> supportedTokens;

    @Value("${pipeline.variant:CRYPTO}")
    private String variant;

    @Value("${pipeline.memory-top-k:2}")
    private int memoryTopK;

    @Value("${pipeline.max-tool-calls-per-report:6}")
    private int maxToolCallsPerReport;

    @Value("${pipeline.generation-timeout:60s}")
    private Duration generationTimeout;

    @Value("${pipeline.tool-timeout:20s}")
    private Duration toolTimeout;

    @Value("${pipeline.risk.override-keywords:liquidity risk}")
    private List<String> overrideKeywords;

    @Value("${pipeline.risk.hold-on-insufficient-evidence:true}")
    private boolean holdOnInsufficientEvidence;

    @Value("${pipeline.risk.fallback-to-trader:true}")
    private boolean fallbackToTrader;

    @Value("${memory.embedding-dimensions:512}")
    private int embeddingDimensions;

    /**
     * Assembled and validated once at startup; an invalid option fails the context
     * before any run can start.
     */
    @Bean
    public PipelineConfig pipelineConfig() {
        PipelineConfig config = new PipelineConfig(
            maxDebateRounds,
            maxRiskDiscussRounds,
            onlineTools,
            parseAnalysts(enabledAnalysts),
            new LinkedHashSet<>(supportedTokens),
            parseVariant(variant),
            memoryTopK,
            maxToolCallsPerReport,
            generationTimeout,
            toolTimeout,
            new RiskPolicySettings(overrideKeywords, holdOnInsufficientEvidence, fallbackToTrader)
        ).validate();
        log.info("[OrchestratorConfig] Pipeline configured. variant={} analysts={} rounds={}/{} onlineTools={} tokens={}",
            config.variant(), config.enabledAnalysts(), config.maxDebateRounds(), config.maxRiskDiscussRounds(),
            config.onlineTools(), config.supportedTokens());
        return config;
    }

    @Bean
    public RiskOverridePolicy riskOverridePolicy(PipelineConfig pipelineConfig) {
        return new RiskOverridePolicy(pipelineConfig.riskPolicy());
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        return new HashingEmbeddingModel(embeddingDimensions);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static Set<AnalystKind> parseAnalysts(List<String> keys) {
        Set<AnalystKind> kinds = EnumSet.noneOf(AnalystKind.class);
        for (String key : keys) {
            if (key == null || key.isBlank()) continue;
            try {
                kinds.add(AnalystKind.fromKey(key));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("pipeline.enabled-analysts: " + e.getMessage());
            }
        }
        return kinds;
    }

    static PipelineVariant parseVariant(String raw) {
        try {
            return PipelineVariant.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("pipeline.variant: unknown variant '" + raw + "'");
        }
    }
}
