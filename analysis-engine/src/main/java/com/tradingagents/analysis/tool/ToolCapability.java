package com.tradingagents.analysis.tool;

import com.tradingagents.common.llm.ToolDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static invocation contract for one named capability.
 */
public record ToolCapability(String name, String description,
                             List<ToolParameter> parameters, CapabilityHandler handler) {

    public ToolCapability {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /** Builds the model-facing definition from the declared parameters. */
    public ToolDefinition toDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ToolParameter p : parameters) {
            properties.put(p.name(), Map.of("type", p.type(), "description", p.description()));
            if (p.required()) required.add(p.name());
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return new ToolDefinition(name, description, schema);
    }

    public List<String> requiredParameters() {
        return parameters.stream().filter(ToolParameter::required).map(ToolParameter::name).toList();
    }
}
