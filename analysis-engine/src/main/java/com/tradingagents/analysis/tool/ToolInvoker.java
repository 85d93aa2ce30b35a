package com.tradingagents.analysis.tool;

import com.tradingagents.common.llm.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Executes a named capability with arguments and always completes with a
 * {@link ToolResult}: data on success, a classified failure otherwise.
 *
 * <p>The invoker imposes a per-call timeout and does not retry; retries belong to the
 * collaborator.
 */
public class ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(ToolInvoker.class);

    private final CapabilityRegistry registry;
    private final Duration timeout;

    public ToolInvoker(CapabilityRegistry registry, Duration timeout) {
        this.registry = registry;
        this.timeout = timeout;
    }

    public Mono<ToolResult> invoke(ToolCall call) {
        ToolCapability capability = registry.find(call.capability()).orElse(null);
        if (capability == null) {
            log.warn("[ToolInvoker] Unknown capability requested. capability={}", call.capability());
            return Mono.just(ToolResult.failed(call.id(), call.capability(),
                FailureKind.UNKNOWN_CAPABILITY, "no capability named '" + call.capability() + "'"));
        }

        for (String required : capability.requiredParameters()) {
            Object value = call.arguments().get(required);
            if (value == null || String.valueOf(value).isBlank()) {
                return Mono.just(ToolResult.failed(call.id(), call.capability(),
                    FailureKind.PERMANENT, "missing required argument '" + required + "'"));
            }
        }

        ToolArguments arguments = toArguments(call.arguments());
        long start = System.currentTimeMillis();

        return Mono.defer(() -> capability.handler().fetch(arguments))
            .timeout(timeout)
            .map(text -> ToolResult.success(call.id(), call.capability(), text))
            .switchIfEmpty(Mono.fromSupplier(() -> ToolResult.failed(call.id(), call.capability(),
                FailureKind.PERMANENT, "collaborator returned no data")))
            .onErrorResume(e -> Mono.just(ToolResult.failed(call.id(), call.capability(),
                classify(e), describe(e))))
            .doOnNext(r -> log.info("[ToolInvoker] capability={} ok={} failure={} latencyMs={}",
                r.capability(), r.succeeded(), r.failure(), System.currentTimeMillis() - start));
    }

    /** Maps collaborator exceptions onto the failure taxonomy. */
    static FailureKind classify(Throwable e) {
        if (e instanceof ToolFailureException tfe) return tfe.getKind();
        if (e instanceof TimeoutException) return FailureKind.TRANSIENT;
        if (e instanceof WebClientRequestException) return FailureKind.TRANSIENT;
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return status >= 500 || status == 429 ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
        }
        if (e instanceof IllegalArgumentException) return FailureKind.PERMANENT;
        return FailureKind.TRANSIENT;
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) return "timed out";
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ToolArguments toArguments(Map<String, Object> raw) {
        Object symbol = raw.get("symbol");
        Integer days = null;
        Object rawDays = raw.get("days");
        if (rawDays instanceof Number n) {
            days = n.intValue();
        } else if (rawDays != null) {
            try {
                days = Integer.parseInt(String.valueOf(rawDays).trim());
            } catch (NumberFormatException ignored) {
                days = null;
            }
        }
        return new ToolArguments(
            symbol == null ? null : String.valueOf(symbol).trim().toUpperCase(Locale.ROOT),
            days, raw);
    }
}
