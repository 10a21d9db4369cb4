package com.birdschema.introspect;

import com.birdschema.SchemaExportException;

public class DatabaseConnectionException extends SchemaExportException {

    public DatabaseConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
