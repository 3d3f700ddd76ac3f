package org.clinidex.core.exception;

/**
 * Exception thrown when a search rule cannot convert a value present in a document.
 * The write that triggered the extraction is rejected as a whole.
 */
public class ExtractionFailureException extends ClinidexException {

    private final String resourceType;
    private final String resourceId;
    private final String ruleName;

    public ExtractionFailureException(String resourceType, String ruleName, String detail, Throwable cause) {
        this(resourceType, null, ruleName, detail, cause);
    }

    public ExtractionFailureException(String resourceType, String resourceId, String ruleName,
                                      String detail, Throwable cause) {
        super(String.format("Rule '%s' failed on %s/%s", ruleName, resourceType,
                        resourceId != null ? resourceId : "(unassigned)"),
                "exception",
                detail,
                cause);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.ruleName = ruleName;
    }

    /**
     * Returns a copy of this failure bound to the id of the document being written.
     */
    public ExtractionFailureException forDocument(String id) {
        return new ExtractionFailureException(resourceType, id, ruleName, getDiagnostics(), getCause());
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getRuleName() {
        return ruleName;
    }
}
