package com.tradingagents.analysis.tool;

import com.tradingagents.analysis.support.StubCapabilities;
import com.tradingagents.common.exception.ConfigurationException;
import com.tradingagents.common.llm.ToolDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    @Test
    @DisplayName("duplicate names are rejected at construction")
    void duplicateNamesRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new CapabilityRegistry(List.of(
            StubCapabilities.answering("get_a", "1"),
            StubCapabilities.answering("get_a", "2"))));
        assertTrue(e.getMessage().contains("duplicate capability get_a"));
    }

    @Test
    @DisplayName("missing description and handler are reported together")
    void everyProblemReported() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new CapabilityRegistry(List.of(
            new ToolCapability("get_a", "", List.of(), null))));
        assertTrue(e.getMessage().contains("get_a has no description"));
        assertTrue(e.getMessage().contains("get_a has no handler"));
    }

    @Test
    @DisplayName("requireAll() names the unregistered capabilities")
    void requireAll() {
        CapabilityRegistry registry = new CapabilityRegistry(List.of(StubCapabilities.answering("get_a", "1")));

        assertDoesNotThrow(() -> registry.requireAll("Analyst", List.of("get_a")));
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> registry.requireAll("Analyst", List.of("get_a", "get_b")));
        assertTrue(e.getMessage().contains("get_b"));
    }

    @Test
    @DisplayName("definitionsFor() keeps caller order and builds a JSON schema")
    void definitions() {
        CapabilityRegistry registry = new CapabilityRegistry(List.of(
            StubCapabilities.answering("get_a", "1"),
            new ToolCapability("get_b", "needs a symbol", List.of(ToolParameter.symbol()), args -> null)));

        List<ToolDefinition> defs = registry.definitionsFor(List.of("get_b", "unknown", "get_a"));

        assertEquals(List.of("get_b", "get_a"), defs.stream().map(ToolDefinition::name).toList());
        Map<String, Object> schema = defs.get(0).inputSchema();
        assertEquals("object", schema.get("type"));
        assertEquals(List.of("symbol"), schema.get("required"));
    }
}
