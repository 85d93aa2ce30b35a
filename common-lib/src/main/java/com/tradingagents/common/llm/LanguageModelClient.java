package com.tradingagents.common.llm;

import reactor.core.publisher.Mono;

/**
 * Opaque text-generation backend.
 *
 * <p>Callers assume only that a reply carries text (and possibly tool-call requests) or
 * that the returned {@code Mono} errors. Repeated calls with the same request are not
 * required to return identical replies.
 */
public interface LanguageModelClient {

    Mono<ModelReply> generate(ModelRequest request);
}
