package com.debateplatform.common.exception;

/** Invalid debate configuration, e.g. {@code max_rounds < 1}. */
public class DebateConfigurationException extends RuntimeException {

    public DebateConfigurationException(String message) {
        super(message);
    }

    public DebateConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
