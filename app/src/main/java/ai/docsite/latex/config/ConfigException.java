package ai.docsite.latex.config;

import ai.docsite.latex.diagnostics.ConversionException;

/**
 * Raised for invalid configuration values, invalid mapping entries and unknown transform names.
 */
public class ConfigException extends ConversionException {

    public ConfigException(String key, String message) {
        super("configuration", key, message);
    }

    public ConfigException(String key, String message, Throwable cause) {
        super("configuration", key, message, cause);
    }
}
