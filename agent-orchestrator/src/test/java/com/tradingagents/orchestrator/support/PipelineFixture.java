package com.tradingagents.orchestrator.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.agent.AnalystAgent;
import com.tradingagents.analysis.agent.MarketAnalyst;
import com.tradingagents.analysis.agent.NewsAnalyst;
import com.tradingagents.analysis.agent.OnChainAnalyst;
import com.tradingagents.analysis.agent.SocialAnalyst;
import com.tradingagents.analysis.service.AnalystDispatchService;
import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.analysis.tool.ToolCapability;
import com.tradingagents.analysis.tool.ToolInvoker;
import com.tradingagents.analysis.tool.provider.CoinGeckoCapabilities;
import com.tradingagents.analysis.tool.provider.CryptoNewsCapabilities;
import com.tradingagents.analysis.tool.provider.OnChainCapabilities;
import com.tradingagents.analysis.tool.provider.SentimentCapabilities;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.config.RiskPolicySettings;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.memory.HashingEmbeddingModel;
import com.tradingagents.common.model.AnalystKind;
import com.tradingagents.orchestrator.debate.DebateController;
import com.tradingagents.orchestrator.graph.GraphOrchestrator;
import com.tradingagents.orchestrator.graph.RunRegistry;
import com.tradingagents.orchestrator.logger.PipelineFlowLogger;
import com.tradingagents.orchestrator.memory.MemoryBank;
import com.tradingagents.orchestrator.memory.ReflectionService;
import com.tradingagents.orchestrator.synthesis.DecisionParser;
import com.tradingagents.orchestrator.synthesis.ResearchManager;
import com.tradingagents.orchestrator.synthesis.RiskManager;
import com.tradingagents.orchestrator.synthesis.RiskOverridePolicy;
import com.tradingagents.orchestrator.synthesis.Trader;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Fully wired pipeline over a scripted model and in-memory capabilities, without Spring.
 */
public class PipelineFixture {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC);

    public static final List<String> ALL_CAPABILITIES = List.of(
        CoinGeckoCapabilities.PRICE_DATA, CoinGeckoCapabilities.GLOBAL_MARKET,
        CoinGeckoCapabilities.TRENDING, CoinGeckoCapabilities.PROJECT_STATS,
        SentimentCapabilities.FEAR_GREED,
        OnChainCapabilities.BITCOIN_ONCHAIN, OnChainCapabilities.ETHEREUM_ONCHAIN,
        CryptoNewsCapabilities.CRYPTO_NEWS, CryptoNewsCapabilities.REGULATORY_NEWS);

    public final GraphOrchestrator orchestrator;
    public final MemoryBank memoryBank;
    public final RunRegistry runRegistry;
    public final ReflectionService reflectionService;
    public final DebateController debateController;

    public PipelineFixture(PipelineConfig config, LanguageModelClient model) {
        List<ToolCapability> stubs = new ArrayList<>();
        for (String name : ALL_CAPABILITIES) {
            stubs.add(new ToolCapability(name, "stub " + name, List.of(), args -> Mono.just(name + " data")));
        }
        CapabilityRegistry registry = new CapabilityRegistry(stubs);
        ToolInvoker invoker = new ToolInvoker(registry, config.toolTimeout());

        List<AnalystAgent> analysts = List.of(
            new MarketAnalyst(model, invoker, registry, config),
            new OnChainAnalyst(model, invoker, registry, config),
            new NewsAnalyst(model, invoker, registry, config),
            new SocialAnalyst(model, invoker, registry, config));

        this.memoryBank = new MemoryBank(new HashingEmbeddingModel());
        this.runRegistry = new RunRegistry(100);
        this.reflectionService = new ReflectionService(memoryBank);
        this.debateController = new DebateController(model, config, CLOCK);
        DecisionParser parser = new DecisionParser(new ObjectMapper());

        this.orchestrator = new GraphOrchestrator(config,
            new AnalystDispatchService(analysts), registry, debateController,
            new ResearchManager(model, parser, memoryBank, config),
            new Trader(model, parser, memoryBank, config),
            new RiskManager(model, parser, memoryBank, config, new RiskOverridePolicy(config.riskPolicy())),
            memoryBank, runRegistry, new PipelineFlowLogger());
    }

    public static PipelineConfig config(Set<AnalystKind> analysts, boolean onlineTools, int rounds) {
        return new PipelineConfig(rounds, rounds, onlineTools, analysts, Set.of("BTC", "ETH", "SOL"),
            PipelineVariant.CRYPTO, 2, 6, Duration.ofSeconds(5), Duration.ofSeconds(2),
            RiskPolicySettings.defaults());
    }
}
