package com.tradingagents.analysis.tool;

import java.util.Map;

/**
 * Uniform argument shape for every capability: an optional symbol, an optional look-back
 * window, and any capability-specific extras.
 */
public record ToolArguments(String symbol, Integer lookbackDays, Map<String, Object> extras) {

    public ToolArguments {
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static ToolArguments none() {
        return new ToolArguments(null, null, Map.of());
    }

    public static ToolArguments forSymbol(String symbol) {
        return new ToolArguments(symbol, null, Map.of());
    }

    /** Integer extra with a default, tolerant of numbers sent as strings. */
    public int intExtra(String key, int defaultValue) {
        Object v = extras.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v != null) {
            try {
                return Integer.parseInt(String.valueOf(v).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public int lookbackOr(int defaultDays) {
        return lookbackDays != null && lookbackDays > 0 ? lookbackDays : defaultDays;
    }
}
