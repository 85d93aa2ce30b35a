package com.tradingagents.common.exception;

/**
 * The language-model backend failed to return text: transport error, missing credentials,
 * or an unreadable response body.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
