package com.birdschema.introspect;

import com.birdschema.SchemaExportException;

/**
 * A catalog or sampling query failed. Aborts the whole export.
 */
public class SchemaIntrospectionException extends SchemaExportException {

    public SchemaIntrospectionException(String message) {
        super(message);
    }

    public SchemaIntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
