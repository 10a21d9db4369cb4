package com.birdschema;

/**
 * Base type for every fatal failure of a schema export run.
 */
public class SchemaExportException extends RuntimeException {

    public SchemaExportException(String message) {
        super(message);
    }

    public SchemaExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
