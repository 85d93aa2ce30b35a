package com.tradingagents.analysis.tool;

/**
 * Why a tool call produced no data. The analyst treats all three the same way
 * (a degraded marker in the report); the distinction is kept for audit and for
 * collaborators that retry on their own.
 */
public enum FailureKind {
    UNKNOWN_CAPABILITY,
    TRANSIENT,
    PERMANENT
}
