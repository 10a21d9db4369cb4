package com.birdschema.config;

import com.birdschema.SchemaExportException;

/**
 * Raised when the run cannot be configured, before any database I/O happens.
 */
public class ConfigurationException extends SchemaExportException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
