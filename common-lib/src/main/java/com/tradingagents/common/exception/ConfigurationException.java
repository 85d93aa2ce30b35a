package com.tradingagents.common.exception;

/**
 * Invalid or missing configuration. Fatal at run start: no stage is attempted.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
