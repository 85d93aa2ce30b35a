package com.tradingagents.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the pipeline run id through reactive chains.
 *
 * <p>Reactor Context is the single source of truth for {@code runId} inside a pipeline.
 * MDC is only written as a temporary bridge while a log statement executes.
 *
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, state.runId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private TraceContextUtil() {}

    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Returns the run id stored in the context, or {@code "unknown"}. Never {@code null}. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code runId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
