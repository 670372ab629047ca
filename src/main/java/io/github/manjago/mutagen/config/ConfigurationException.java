package io.github.manjago.mutagen.config;

/**
 * Invalid configuration detected at construction time.
 * Components throw it eagerly so a misconfigured engine never starts.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
