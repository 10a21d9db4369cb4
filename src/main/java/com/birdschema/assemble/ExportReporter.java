package com.birdschema.assemble;

/**
 * Receives the non-fatal notices raised while assembling a schema document.
 */
public interface ExportReporter {

    /**
     * {@code requested} had no exact match and was resolved to {@code resolved} ignoring case.
     */
    void caseInsensitiveMatch(String dbId, String requested, String resolved);

    /**
     * {@code requested} has no live counterpart and was left out of the document.
     */
    void tableSkipped(String dbId, String requested);
}
