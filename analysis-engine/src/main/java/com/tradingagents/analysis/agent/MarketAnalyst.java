package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.analysis.tool.ToolInvoker;
import com.tradingagents.analysis.tool.provider.CoinGeckoCapabilities;
import com.tradingagents.analysis.tool.provider.SentimentCapabilities;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.model.AnalystKind;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Price action, volume and market-wide context.
 */
@Component
public class MarketAnalyst extends ToolUsingAnalystAgent {

    static final List<String> CAPABILITIES = List.of(
        CoinGeckoCapabilities.PRICE_DATA,
        CoinGeckoCapabilities.GLOBAL_MARKET,
        SentimentCapabilities.FEAR_GREED);

    public MarketAnalyst(LanguageModelClient model, ToolInvoker invoker,
                         CapabilityRegistry registry, PipelineConfig config) {
        super(AnalystKind.MARKET, CAPABILITIES, model, invoker, registry, config);
    }

    @Override
    public List<String> declaredCapabilities(String symbol) {
        return CAPABILITIES;
    }

    @Override
    protected String rolePrompt(String symbol, PipelineVariant variant) {
        if (variant == PipelineVariant.EQUITY) {
            return """
                You are a market analyst. Analyze %s using recent price history and broad market context.
                Identify the trend, key support and resistance levels, momentum and volume behaviour.
                Be specific with price levels and percentages, and append a Markdown table summarizing
                current price, key levels, indicator status and your trading recommendation.
                """.formatted(symbol);
        }
        return """
            You are a cryptocurrency market analyst specializing in technical analysis and market dynamics.
            Crypto trades 24/7, is several times more volatile than equities, and altcoins tend to follow BTC.

            Analyze %s:
            1. Use get_crypto_price_data for price history, trend, support/resistance and volume.
            2. Use get_global_crypto_market for total market cap and BTC/ETH dominance.
            3. Use get_crypto_fear_greed_index for sentiment (<25 extreme fear, >75 extreme greed).

            Be specific with price levels and percentages; explain every call with concrete data.
            Append a Markdown table summarizing current price and 24h change, key levels,
            indicator status, Fear & Greed reading and your trading recommendation.
            """.formatted(symbol);
    }
}
