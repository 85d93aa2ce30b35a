package com.tradingagents.analysis.tool;

import reactor.core.publisher.Mono;

/**
 * External data collaborator behind one capability. Returns a text report or errors;
 * a {@link ToolFailureException} lets the collaborator decide TRANSIENT vs PERMANENT.
 */
@FunctionalInterface
public interface CapabilityHandler {

    Mono<String> fetch(ToolArguments arguments);
}
