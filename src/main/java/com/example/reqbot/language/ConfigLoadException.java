package com.example.reqbot.language;

/**
 * Raised when the language profile configuration is missing required data or cannot be parsed.
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
