package com.tradingagents.orchestrator.logger;

import com.tradingagents.common.model.PipelineStage;
import com.tradingagents.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a run without touching pipeline behaviour.
 *
 * <p>Usage with {@code doOnEach} (reads runId from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineStage.RESEARCH_DEBATE))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    /**
     * Returns a {@code doOnEach} consumer logging completion of {@code stage}.
     * Only fires on {@code onNext}; errors are logged where they are handled.
     */
    public <T> Consumer<Signal<T>> stage(PipelineStage stage) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            TraceContextUtil.withMdc(runId, () ->
                log.info("[PipelineFlow] stage={} completed runId={}", stage, runId)
            );
        };
    }

    public void transition(String runId, PipelineStage from, PipelineStage to) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[PipelineFlow] transition {} -> {} runId={}", from, to, runId)
        );
    }
}
