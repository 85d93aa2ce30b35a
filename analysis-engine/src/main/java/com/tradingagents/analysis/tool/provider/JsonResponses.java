package com.tradingagents.analysis.tool.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolFailureException;

final class JsonResponses {

    private JsonResponses() {}

    static JsonNode read(ObjectMapper objectMapper, String body, String source) {
        if (body == null || body.isBlank()) {
            throw new ToolFailureException(FailureKind.PERMANENT, source + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new ToolFailureException(FailureKind.PERMANENT, "unreadable " + source + " response", e);
        }
    }
}
