package com.birdschema.output;

import com.birdschema.SchemaExportException;

public class OutputException extends SchemaExportException {

    public OutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
