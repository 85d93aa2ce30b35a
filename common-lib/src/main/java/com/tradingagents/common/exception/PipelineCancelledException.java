package com.tradingagents.common.exception;

import com.tradingagents.common.model.RunTrace;

/**
 * The run was cancelled before reaching a final decision. The partial trace keeps
 * everything produced before cancellation was observed.
 */
public class PipelineCancelledException extends RuntimeException {

    private final String runId;
    private final transient RunTrace partialTrace;

    public PipelineCancelledException(String runId, RunTrace partialTrace) {
        super("Run " + runId + " was cancelled");
        this.runId = runId;
        this.partialTrace = partialTrace;
    }

    public String getRunId() {
        return runId;
    }

    public RunTrace getPartialTrace() {
        return partialTrace;
    }
}
