package com.birdschema.manifest;

import com.birdschema.SchemaExportException;

public class ManifestException extends SchemaExportException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
