package com.tradingagents.analysis.tool;

/**
 * Raised by a {@link CapabilityHandler} to report a classified failure.
 * Unclassified exceptions are mapped by {@link ToolInvoker}.
 */
public class ToolFailureException extends RuntimeException {

    private final FailureKind kind;

    public ToolFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ToolFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
