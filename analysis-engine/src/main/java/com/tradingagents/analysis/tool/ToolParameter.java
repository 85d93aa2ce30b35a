package com.tradingagents.analysis.tool;

/**
 * One declared capability parameter.
 *
 * @param type JSON-schema primitive: {@code string} or {@code integer}
 */
public record ToolParameter(String name, String type, String description, boolean required) {

    public static ToolParameter symbol() {
        return new ToolParameter("symbol", "string", "Crypto symbol (e.g. 'BTC', 'ETH', 'SOL')", true);
    }

    public static ToolParameter optionalInt(String name, String description) {
        return new ToolParameter(name, "integer", description, false);
    }
}
