package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.support.ScriptedLanguageModelClient;
import com.tradingagents.analysis.support.StubCapabilities;
import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolCapability;
import com.tradingagents.analysis.tool.ToolInvoker;
import com.tradingagents.analysis.tool.provider.CoinGeckoCapabilities;
import com.tradingagents.analysis.tool.provider.OnChainCapabilities;
import com.tradingagents.analysis.tool.provider.SentimentCapabilities;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.config.RiskPolicySettings;
import com.tradingagents.common.exception.ConfigurationException;
import com.tradingagents.common.exception.SynthesisException;
import com.tradingagents.common.llm.ModelMessage;
import com.tradingagents.common.llm.ModelReply;
import com.tradingagents.common.llm.ModelRequest;
import com.tradingagents.common.llm.ToolCall;
import com.tradingagents.common.model.AnalystKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolUsingAnalystAgentTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);
    private static final Set<String> MARKET_TOOLS = Set.copyOf(MarketAnalyst.CAPABILITIES);

    private static PipelineConfig config(int maxToolCalls) {
        return new PipelineConfig(1, 1, true, EnumSet.of(AnalystKind.MARKET), Set.of("BTC"),
            PipelineVariant.CRYPTO, 2, maxToolCalls, Duration.ofSeconds(5), Duration.ofSeconds(1),
            RiskPolicySettings.defaults());
    }

    private static ToolCall call(String id, String capability) {
        return new ToolCall(id, capability, Map.of("symbol", "BTC"));
    }

    private static MarketAnalyst market(ScriptedLanguageModelClient model, CapabilityRegistry registry, int maxCalls) {
        return new MarketAnalyst(model, new ToolInvoker(registry, Duration.ofSeconds(1)), registry, config(maxCalls));
    }

    @Nested
    @DisplayName("tool loop")
    class ToolLoop {

        @Test
        @DisplayName("tool results are fed back and the final text becomes the report")
        void happyPath() {
            CapabilityRegistry registry = StubCapabilities.registry(MarketAnalyst.CAPABILITIES, Map.of());
            ScriptedLanguageModelClient model = ScriptedLanguageModelClient.replying(
                ModelReply.toolCalls(List.of(call("t1", CoinGeckoCapabilities.PRICE_DATA))),
                ModelReply.text("BTC is trending up."));

            StepVerifier.create(market(model, registry, 6).run("BTC", DATE, MARKET_TOOLS))
                .assertNext(report -> {
                    assertEquals(AnalystKind.MARKET, report.kind());
                    assertEquals("BTC is trending up.", report.text());
                    assertFalse(report.degraded());
                    assertEquals(1, report.toolCalls());
                })
                .verifyComplete();

            ModelRequest second = model.requests().get(1);
            ModelMessage toolMessage = second.messages().get(second.messages().size() - 1);
            assertEquals(ModelMessage.Role.TOOL, toolMessage.role());
            assertEquals("t1", toolMessage.toolCallId());
            assertEquals(CoinGeckoCapabilities.PRICE_DATA + " data", toolMessage.content());
        }

        @Test
        @DisplayName("never exceeds the per-report tool-call limit and ends with a tool-free request")
        void limitRespected() {
            AtomicInteger executed = new AtomicInteger();
            CapabilityRegistry registry = StubCapabilities.registry(MarketAnalyst.CAPABILITIES,
                Map.of(CoinGeckoCapabilities.PRICE_DATA, StubCapabilities.counting(CoinGeckoCapabilities.PRICE_DATA, executed)));
            ScriptedLanguageModelClient model = ScriptedLanguageModelClient.replying(
                ModelReply.toolCalls(List.of(
                    call("t1", CoinGeckoCapabilities.PRICE_DATA),
                    call("t2", CoinGeckoCapabilities.PRICE_DATA))),
                ModelReply.text("done"));

            StepVerifier.create(market(model, registry, 2).run("BTC", DATE, MARKET_TOOLS))
                .assertNext(report -> assertEquals(2, report.toolCalls()))
                .verifyComplete();

            assertEquals(2, executed.get());
            assertEquals(2, model.requests().size());
            assertTrue(model.requests().get(1).tools().isEmpty());
            assertTrue(model.requests().get(1).lastUserMessage().contains("budget"));
        }

        @Test
        @DisplayName("calls beyond the remaining budget in one reply are dropped")
        void excessCallsInOneReplyDropped() {
            AtomicInteger executed = new AtomicInteger();
            CapabilityRegistry registry = StubCapabilities.registry(MarketAnalyst.CAPABILITIES,
                Map.of(CoinGeckoCapabilities.PRICE_DATA, StubCapabilities.counting(CoinGeckoCapabilities.PRICE_DATA, executed)));
            ScriptedLanguageModelClient model = ScriptedLanguageModelClient.replying(
                ModelReply.toolCalls(List.of(
                    call("t1", CoinGeckoCapabilities.PRICE_DATA),
                    call("t2", CoinGeckoCapabilities.PRICE_DATA),
                    call("t3", CoinGeckoCapabilities.PRICE_DATA))),
                ModelReply.text("done"));

            StepVerifier.create(market(model, registry, 1).run("BTC", DATE, MARKET_TOOLS))
                .assertNext(report -> assertEquals(1, report.toolCalls()))
                .verifyComplete();
            assertEquals(1, executed.get());
        }
    }

    @Nested
    @DisplayName("degraded reports")
    class Degraded {

        @Test
        @DisplayName("every tool failing → caveat and degraded markers")
        void allToolsFail() {
            Map<String, ToolCapability> failures = Map.of(
                CoinGeckoCapabilities.PRICE_DATA, StubCapabilities.failing(CoinGeckoCapabilities.PRICE_DATA, FailureKind.TRANSIENT),
                SentimentCapabilities.FEAR_GREED, StubCapabilities.failing(SentimentCapabilities.FEAR_GREED, FailureKind.PERMANENT));
            CapabilityRegistry registry = StubCapabilities.registry(MarketAnalyst.CAPABILITIES, failures);
            ScriptedLanguageModelClient model = ScriptedLanguageModelClient.replying(
                ModelReply.toolCalls(List.of(
                    call("t1", CoinGeckoCapabilities.PRICE_DATA),
                    call("t2", SentimentCapabilities.FEAR_GREED))),
                ModelReply.text("Unable to assess."));

            StepVerifier.create(market(model, registry, 6).run("BTC", DATE, MARKET_TOOLS))
                .assertNext(report -> {
                    assertTrue(report.degraded());
                    assertTrue(report.text().startsWith(ToolUsingAnalystAgent.DATA_UNAVAILABLE_PREFIX));
                    assertTrue(report.text().contains("data unavailable"));
                    assertEquals(2, report.degradedMarkers().size());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("one success among failures → not degraded, failure still listed")
        void partialFailure() {
            CapabilityRegistry registry = StubCapabilities.registry(MarketAnalyst.CAPABILITIES, Map.of(
                SentimentCapabilities.FEAR_GREED, StubCapabilities.failing(SentimentCapabilities.FEAR_GREED, FailureKind.TRANSIENT)));
            ScriptedLanguageModelClient model = ScriptedLanguageModelClient.replying(
                ModelReply.toolCalls(List.of(
                    call("t1", CoinGeckoCapabilities.PRICE_DATA),
                    call("t2", SentimentCapabilities.FEAR_GREED))),
                ModelReply.text("Partial view."));

            StepVerifier.create(market(model, registry, 6).run("BTC", DATE, MARKET_TOOLS))
                .assertNext(report -> {
                    assertFalse(report.degraded());
                    assertEquals(List.of(SentimentCapabilities.FEAR_GREED + " unavailable (TRANSIENT)"),
                        report.degradedMarkers());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("offline run: no tools offered, report carries the caveat")
        void offline() {
            CapabilityRegistry registry = StubCapabilities.registry(MarketAnalyst.CAPABILITIES, Map.of());
            ScriptedLanguageModelClient model = ScriptedLanguageModelClient.replying(ModelReply.text("From memory only."));

            StepVerifier.create(market(model, registry, 6).run("BTC", DATE, Set.of()))
                .assertNext(report -> {
                    assertTrue(report.degraded());
                    assertTrue(report.text().contains("data unavailable"));
                    assertEquals(0, report.toolCalls());
                })
                .verifyComplete();
            assertTrue(model.requests().get(0).tools().isEmpty());
        }

        @Test
        @DisplayName("blank model text → SynthesisException")
        void blankText() {
            CapabilityRegistry registry = StubCapabilities.registry(MarketAnalyst.CAPABILITIES, Map.of());
            ScriptedLanguageModelClient model = ScriptedLanguageModelClient.replying(ModelReply.text("   "));

            StepVerifier.create(market(model, registry, 6).run("BTC", DATE, Set.of()))
                .expectError(SynthesisException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("declaring an unregistered capability fails at startup")
        void unregisteredCapability() {
            CapabilityRegistry registry = StubCapabilities.registry(List.of(CoinGeckoCapabilities.PRICE_DATA), Map.of());
            assertThrows(ConfigurationException.class,
                () -> market(ScriptedLanguageModelClient.replying(), registry, 6));
        }

        @Test
        @DisplayName("on-chain analyst picks its tool set by chain")
        void onChainToolSets() {
            CapabilityRegistry registry = StubCapabilities.registry(List.of(
                OnChainCapabilities.BITCOIN_ONCHAIN, OnChainCapabilities.ETHEREUM_ONCHAIN,
                CoinGeckoCapabilities.PROJECT_STATS, CoinGeckoCapabilities.PRICE_DATA,
                CoinGeckoCapabilities.GLOBAL_MARKET), Map.of());
            OnChainAnalyst analyst = new OnChainAnalyst(ScriptedLanguageModelClient.replying(),
                new ToolInvoker(registry, Duration.ofSeconds(1)), registry, config(6));

            assertEquals(OnChainAnalyst.BITCOIN_TOOLS, analyst.declaredCapabilities("btc"));
            assertEquals(OnChainAnalyst.ETHEREUM_TOOLS, analyst.declaredCapabilities("ETH"));
            assertEquals(OnChainAnalyst.GENERIC_TOOLS, analyst.declaredCapabilities("SOL"));
        }
    }
}
