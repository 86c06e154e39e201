package org.app.challenge.exception;

/**
 * Malformed scenario or profile definitions. Raised while the engine is being assembled;
 * a registry is never built from a definition set that fails validation.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }
}
