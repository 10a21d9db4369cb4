package com.birdschema.assemble;

/**
 * Outcome of looking up one manifest table name among the live tables.
 * {@code resolvedName} is null when {@code kind} is {@link Kind#UNRESOLVED}.
 */
public record TableResolution(String requestedName, String resolvedName, Kind kind) {

    public enum Kind { EXACT, CASE_INSENSITIVE, UNRESOLVED }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }
}
