package org.clinidex.core.exception;

/**
 * Exception thrown when a document or its key fails structural well-formedness.
 */
public class MalformedDocumentException extends ClinidexException {

    private final String fieldPath;

    public MalformedDocumentException(String message, String fieldPath) {
        super(message, "structure", fieldPath != null ? "Offending field: " + fieldPath : null);
        this.fieldPath = fieldPath;
    }

    public MalformedDocumentException(String message, String fieldPath, Throwable cause) {
        super(message, "structure", fieldPath != null ? "Offending field: " + fieldPath : null, cause);
        this.fieldPath = fieldPath;
    }

    public String getFieldPath() {
        return fieldPath;
    }
}
