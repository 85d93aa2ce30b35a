package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.analysis.tool.ToolInvoker;
import com.tradingagents.analysis.tool.ToolResult;
import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.config.PipelineVariant;
import com.tradingagents.common.exception.SynthesisException;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.llm.ModelMessage;
import com.tradingagents.common.llm.ModelReply;
import com.tradingagents.common.llm.ModelRequest;
import com.tradingagents.common.llm.ModelTier;
import com.tradingagents.common.llm.ToolCall;
import com.tradingagents.common.llm.ToolDefinition;
import com.tradingagents.common.model.AnalystKind;
import com.tradingagents.common.model.AnalystReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Shared tool-use loop for the data-gathering analysts.
 *
 * <p>The model is offered the capabilities that are both declared by the analyst and
 * enabled for the run. Requested calls are executed sequentially and their results fed
 * back until the model answers with text or the per-report call budget is spent, at which
 * point one final tool-free synthesis is requested. A report with no successful call is
 * prefixed with {@link #DATA_UNAVAILABLE_PREFIX} and marked degraded.
 */
public abstract class ToolUsingAnalystAgent implements AnalystAgent {

    private static final Logger log = LoggerFactory.getLogger(ToolUsingAnalystAgent.class);

    public static final String DATA_UNAVAILABLE_PREFIX = "[DATA UNAVAILABLE]";

    private static final int MAX_REPORT_TOKENS = 2048;

    private static final String COLLABORATOR_PROMPT = """
        You are a helpful AI assistant, collaborating with other assistants on a trading decision.
        Use the provided tools to progress towards answering the question. If you are unable to
        fully answer, that's OK; another assistant with different tools will help where you left off.
        If you or any other assistant reaches a final deliverable, prefix your response with
        FINAL TRANSACTION PROPOSAL: **BUY/HOLD/SELL** so the team knows to stop.
        """;

    private final AnalystKind kind;
    private final LanguageModelClient model;
    private final ToolInvoker invoker;
    private final CapabilityRegistry registry;
    private final PipelineConfig config;

    protected ToolUsingAnalystAgent(AnalystKind kind, Collection<String> allCapabilities,
                                    LanguageModelClient model, ToolInvoker invoker,
                                    CapabilityRegistry registry, PipelineConfig config) {
        this.kind = kind;
        this.model = model;
        this.invoker = invoker;
        this.registry = registry;
        this.config = config;
        registry.requireAll(kind.displayName(), allCapabilities);
    }

    /** Role-specific instructions; wording may differ between pipeline variants. */
    protected abstract String rolePrompt(String symbol, PipelineVariant variant);

    @Override
    public AnalystKind kind() {
        return kind;
    }

    @Override
    public String agentName() {
        return kind.displayName();
    }

    @Override
    public Mono<AnalystReport> run(String symbol, LocalDate tradeDate, Set<String> enabledTools) {
        return Mono.defer(() -> {
            List<String> usable = declaredCapabilities(symbol).stream()
                .filter(enabledTools::contains)
                .toList();
            Session session = new Session(symbol, registry.definitionsFor(usable));
            session.messages.add(ModelMessage.user(taskPrompt(symbol, tradeDate, !usable.isEmpty())));
            log.info("[{}] Starting analysis symbol={} date={} tools={}", agentName(), symbol, tradeDate, usable);
            return converse(session);
        });
    }

    private Mono<AnalystReport> converse(Session session) {
        boolean toolsAllowed = !session.tools.isEmpty() && session.callsUsed < config.maxToolCallsPerReport();
        if (!toolsAllowed) {
            if (!session.tools.isEmpty() && !session.budgetNoticeSent) {
                session.messages.add(ModelMessage.user(
                    "The tool-call budget for this report is spent. Write the final report now "
                        + "using only the data gathered so far."));
                session.budgetNoticeSent = true;
            }
            session.enter(AnalystPhase.SYNTHESIZING, agentName());
        }

        ModelRequest request = new ModelRequest(agentName(), ModelTier.QUICK,
            COLLABORATOR_PROMPT + "\n" + rolePrompt(session.symbol, config.variant()),
            session.messages, toolsAllowed ? session.tools : List.of(), MAX_REPORT_TOKENS);

        return model.generate(request)
            .timeout(config.generationTimeout())
            .flatMap(reply -> toolsAllowed && reply.requestsTools()
                ? executeTools(session, reply)
                : finish(session, reply));
    }

    private Mono<AnalystReport> executeTools(Session session, ModelReply reply) {
        int remaining = config.maxToolCallsPerReport() - session.callsUsed;
        List<ToolCall> granted = reply.toolCalls().subList(0, Math.min(remaining, reply.toolCalls().size()));
        if (granted.size() < reply.toolCalls().size()) {
            log.info("[{}] Tool budget reached. requested={} granted={}",
                agentName(), reply.toolCalls().size(), granted.size());
        }
        session.enter(AnalystPhase.AWAITING_TOOL_RESULTS, agentName());
        session.callsUsed += granted.size();
        session.messages.add(ModelMessage.assistant(reply.text(), granted));

        return Flux.fromIterable(granted)
            .concatMap(invoker::invoke)
            .collectList()
            .flatMap(results -> {
                for (ToolResult result : results) {
                    session.results.add(result);
                    session.messages.add(ModelMessage.toolResult(result.callId(),
                        result.modelFacingText(), !result.succeeded()));
                }
                return converse(session);
            });
    }

    private Mono<AnalystReport> finish(Session session, ModelReply reply) {
        String text = reply.text().strip();
        if (text.isEmpty()) {
            return Mono.error(new SynthesisException(agentName(),
                "model produced no report text for " + session.symbol));
        }

        boolean anySucceeded = session.results.stream().anyMatch(ToolResult::succeeded);
        List<String> markers = session.results.stream()
            .filter(r -> !r.succeeded())
            .map(ToolResult::degradedMarker)
            .toList();
        if (!anySucceeded) {
            text = DATA_UNAVAILABLE_PREFIX + " No live " + kind.key() + " data could be retrieved for "
                + session.symbol + "; data unavailable, findings below are not backed by current data.\n\n"
                + text;
            if (markers.isEmpty()) markers = List.of("no data tools available");
        }
        session.enter(AnalystPhase.DONE, agentName());
        log.info("[{}] Report complete. symbol={} toolCalls={} degraded={}",
            agentName(), session.symbol, session.callsUsed, !anySucceeded);
        return Mono.just(new AnalystReport(kind, text, !anySucceeded, markers, session.callsUsed));
    }

    private String taskPrompt(String symbol, LocalDate tradeDate, boolean toolsAvailable) {
        String reference = config.variant().assetReference(symbol);
        String data = toolsAvailable
            ? "Gather the data you need with the available tools before writing."
            : "No data tools are available in this run. State clearly that live data is unavailable.";
        return "For your reference, the current date is " + tradeDate + ". " + reference + ". " + data;
    }

    /** Mutable per-run state; confined to one sequential chain. */
    private static final class Session {
        final String symbol;
        final List<ToolDefinition> tools;
        final List<ModelMessage> messages = new ArrayList<>();
        final List<ToolResult> results = new ArrayList<>();
        int callsUsed;
        boolean budgetNoticeSent;
        AnalystPhase phase = AnalystPhase.IDLE;

        Session(String symbol, List<ToolDefinition> tools) {
            this.symbol = symbol;
            this.tools = tools;
        }

        void enter(AnalystPhase next, String agentName) {
            if (next != phase) {
                log.debug("[{}] phase {} -> {} symbol={}", agentName, phase, next, symbol);
                phase = next;
            }
        }
    }
}
