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

@Component
public class SocialAnalyst extends ToolUsingAnalystAgent {

    static final List<String> CAPABILITIES = List.of(
        CoinGeckoCapabilities.TRENDING,
        SentimentCapabilities.FEAR_GREED);

    public SocialAnalyst(LanguageModelClient model, ToolInvoker invoker,
                         CapabilityRegistry registry, PipelineConfig config) {
        super(AnalystKind.SOCIAL, CAPABILITIES, model, invoker, registry, config);
    }

    @Override
    public List<String> declaredCapabilities(String symbol) {
        return CAPABILITIES;
    }

    @Override
    protected String rolePrompt(String symbol, PipelineVariant variant) {
        return """
            You are a social sentiment analyst. Assess crowd sentiment and attention around %s:
            whether it is trending, how the overall fear/greed reading has shifted, and whether
            retail enthusiasm looks early, crowded or exhausted. Call out contrarian signals.
            Append a Markdown table summarizing attention, sentiment and your read of positioning.
            """.formatted(symbol);
    }
}
