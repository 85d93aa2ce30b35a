package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.analysis.tool.ToolInvoker;
import com.tradingagents.analysis.tool.provider.CryptoNewsCapabilities;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.model.AnalystKind;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class NewsAnalyst extends ToolUsingAnalystAgent {

    static final List<String> CAPABILITIES = List.of(
        CryptoNewsCapabilities.CRYPTO_NEWS,
        CryptoNewsCapabilities.REGULATORY_NEWS);

    public NewsAnalyst(LanguageModelClient model, ToolInvoker invoker,
                       CapabilityRegistry registry, PipelineConfig config) {
        super(AnalystKind.NEWS, CAPABILITIES, model, invoker, registry, config);
    }

    @Override
    public List<String> declaredCapabilities(String symbol) {
        return CAPABILITIES;
    }

    @Override
    protected String rolePrompt(String symbol, PipelineVariant variant) {
        return """
            You are a news researcher covering %s for a trading team. Review recent headlines
            about %s and the broader %s market, with particular attention to regulatory and
            legal developments. Separate material events from noise, judge whether each item is
            bullish, bearish or neutral, and estimate how long its impact is likely to last.
            Append a Markdown table listing the key stories, their direction and their weight.
            """.formatted(variant.assetNoun() + " markets", symbol, variant.assetNoun());
    }
}
