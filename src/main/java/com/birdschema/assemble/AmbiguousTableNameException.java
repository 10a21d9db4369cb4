package com.birdschema.assemble;

import com.birdschema.introspect.SchemaIntrospectionException;

import java.util.List;

/**
 * A manifest table name has no exact live match and more than one live table
 * matches it ignoring case.
 */
public class AmbiguousTableNameException extends SchemaIntrospectionException {
    private final String requestedName;
    private final List<String> candidates;

    public AmbiguousTableNameException(String requestedName, List<String> candidates) {
        super("Table '" + requestedName + "' matches several tables ignoring case: " + candidates);
        this.requestedName = requestedName;
        this.candidates = List.copyOf(candidates);
    }

    public String getRequestedName() {
        return requestedName;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
