package com.tradingagents.common.exception;

/**
 * An agent or synthesizer could not produce any usable output.
 */
public class SynthesisException extends RuntimeException {

    private final String agentName;

    public SynthesisException(String agentName, String message) {
        super("[" + agentName + "] " + message);
        this.agentName = agentName;
    }

    public SynthesisException(String agentName, String message, Throwable cause) {
        super("[" + agentName + "] " + message, cause);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
