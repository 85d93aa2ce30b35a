package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.analysis.tool.ToolInvoker;
import com.tradingagents.analysis.tool.provider.CoinGeckoCapabilities;
import com.tradingagents.analysis.tool.provider.OnChainCapabilities;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.model.AnalystKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Network health and on-chain activity. The tool set depends on the chain:
 * Bitcoin and Ethereum have dedicated metrics, everything else falls back to
 * project-level statistics.
 */
@Component
public class OnChainAnalyst extends ToolUsingAnalystAgent {

    static final List<String> BITCOIN_TOOLS = List.of(
        OnChainCapabilities.BITCOIN_ONCHAIN, CoinGeckoCapabilities.PRICE_DATA, CoinGeckoCapabilities.GLOBAL_MARKET);
    static final List<String> ETHEREUM_TOOLS = List.of(
        OnChainCapabilities.ETHEREUM_ONCHAIN, CoinGeckoCapabilities.PRICE_DATA, CoinGeckoCapabilities.GLOBAL_MARKET);
    static final List<String> GENERIC_TOOLS = List.of(
        CoinGeckoCapabilities.PROJECT_STATS, CoinGeckoCapabilities.PRICE_DATA, CoinGeckoCapabilities.GLOBAL_MARKET);

    public OnChainAnalyst(LanguageModelClient model, ToolInvoker invoker,
                          CapabilityRegistry registry, PipelineConfig config) {
        super(AnalystKind.ONCHAIN,
            List.of(OnChainCapabilities.BITCOIN_ONCHAIN, OnChainCapabilities.ETHEREUM_ONCHAIN,
                CoinGeckoCapabilities.PROJECT_STATS, CoinGeckoCapabilities.PRICE_DATA,
                CoinGeckoCapabilities.GLOBAL_MARKET),
            model, invoker, registry, config);
    }

    @Override
    public List<String> declaredCapabilities(String symbol) {
        return switch (symbol == null ? "" : symbol.toUpperCase(Locale.ROOT)) {
            case "BTC" -> BITCOIN_TOOLS;
            case "ETH" -> ETHEREUM_TOOLS;
            default    -> GENERIC_TOOLS;
        };
    }

    @Override
    protected String rolePrompt(String symbol, PipelineVariant variant) {
        return """
            You are an on-chain analyst specializing in blockchain analysis. Analyze the on-chain
            metrics and network health of %s to inform a trading decision:
            - Network security and usage: hash rate, difficulty, block times, transaction counts.
            - Fees and congestion: mempool backlog or gas prices, and what they say about demand.
            - Supply dynamics and holder activity.
            - Developer and community activity where chain metrics are not available.

            Relate the on-chain picture to current price action. Flag divergences between network
            activity and price. Append a Markdown table summarizing network health, activity trend,
            congestion and your on-chain outlook.
            """.formatted(symbol);
    }
}
