package com.tradingagents.common.exception;

import com.tradingagents.common.model.PipelineStage;
import com.tradingagents.common.model.RunTrace;

/**
 * The run could not reach a final decision. Carries the stage that failed and the
 * partial trace recorded up to that point.
 */
public class PipelineAbortedException extends RuntimeException {

    private final String runId;
    private final PipelineStage failedStage;
    private final transient RunTrace partialTrace;

    public PipelineAbortedException(String runId, PipelineStage failedStage,
                                    RunTrace partialTrace, String message, Throwable cause) {
        super("Run " + runId + " aborted at " + failedStage + ": " + message, cause);
        this.runId = runId;
        this.failedStage = failedStage;
        this.partialTrace = partialTrace;
    }

    public String getRunId() {
        return runId;
    }

    public PipelineStage getFailedStage() {
        return failedStage;
    }

    public RunTrace getPartialTrace() {
        return partialTrace;
    }
}
