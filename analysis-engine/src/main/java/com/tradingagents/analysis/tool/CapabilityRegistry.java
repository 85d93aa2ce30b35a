package com.tradingagents.analysis.tool;

import com.tradingagents.common.exception.ConfigurationException;
import com.tradingagents.common.llm.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static registry of every capability an analyst may call, keyed by name.
 *
 * <p>Built once at startup and read-only afterwards. The model-facing tool list is derived
 * from this registry, never from runtime introspection.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, ToolCapability> capabilities;

    public CapabilityRegistry(Collection<ToolCapability> capabilities) {
        Map<String, ToolCapability> byName = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();
        for (ToolCapability c : capabilities) {
            if (c.name() == null || c.name().isBlank()) {
                problems.add("capability with blank name");
                continue;
            }
            if (c.description() == null || c.description().isBlank()) {
                problems.add(c.name() + " has no description");
            }
            if (c.handler() == null) {
                problems.add(c.name() + " has no handler");
            }
            if (byName.putIfAbsent(c.name(), c) != null) {
                problems.add("duplicate capability " + c.name());
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid capability registry: " + String.join("; ", problems));
        }
        this.capabilities = Collections.unmodifiableMap(byName);
        log.info("[CapabilityRegistry] registered capabilities={}", this.capabilities.keySet());
    }

    public Optional<ToolCapability> find(String name) {
        return Optional.ofNullable(capabilities.get(name));
    }

    public boolean contains(String name) {
        return capabilities.containsKey(name);
    }

    public Set<String> names() {
        return capabilities.keySet();
    }

    /**
     * Fails fast when an analyst declares capabilities the registry does not know.
     *
     * @throws ConfigurationException naming the agent and the missing capabilities
     */
    public void requireAll(String agentName, Collection<String> declared) {
        List<String> missing = declared.stream().filter(n -> !capabilities.containsKey(n)).toList();
        if (!missing.isEmpty()) {
            throw new ConfigurationException(agentName + " declares unregistered capabilities " + missing);
        }
    }

    /** Model-facing definitions for the given names, in the caller's order; unknown names are skipped. */
    public List<ToolDefinition> definitionsFor(Collection<String> names) {
        return names.stream()
            .map(capabilities::get)
            .filter(c -> c != null)
            .map(ToolCapability::toDefinition)
            .toList();
    }
}
