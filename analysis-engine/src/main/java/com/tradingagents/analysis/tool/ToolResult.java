package com.tradingagents.analysis.tool;

/**
 * Outcome of one tool call: text on success, a {@link FailureKind} otherwise.
 */
public record ToolResult(String callId, String capability, String text,
                         FailureKind failure, String detail) {

    public static ToolResult success(String callId, String capability, String text) {
        return new ToolResult(callId, capability, text, null, null);
    }

    public static ToolResult failed(String callId, String capability, FailureKind kind, String detail) {
        return new ToolResult(callId, capability, null, kind, detail);
    }

    public boolean succeeded() {
        return failure == null;
    }

    /** Text handed back to the model for this call. */
    public String modelFacingText() {
        return succeeded()
            ? text
            : "Tool " + capability + " failed (" + failure + "): " + detail + ". Treat this data as unavailable.";
    }

    /** Short marker recorded in a degraded report. */
    public String degradedMarker() {
        return capability + " unavailable (" + failure + ")";
    }
}
