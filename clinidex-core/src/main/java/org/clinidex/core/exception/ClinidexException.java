package org.clinidex.core.exception;

/**
 * Base exception for all store and search errors.
 */
public class ClinidexException extends RuntimeException {

    private final String issueCode;
    private final String diagnostics;

    public ClinidexException(String message) {
        this(message, "processing", null);
    }

    public ClinidexException(String message, String issueCode) {
        this(message, issueCode, null);
    }

    public ClinidexException(String message, String issueCode, String diagnostics) {
        super(message);
        this.issueCode = issueCode;
        this.diagnostics = diagnostics;
    }

    public ClinidexException(String message, String issueCode, String diagnostics, Throwable cause) {
        super(message, cause);
        this.issueCode = issueCode;
        this.diagnostics = diagnostics;
    }

    /**
     * Returns the issue type code, in the vocabulary of an OperationOutcome.
     */
    public String getIssueCode() {
        return issueCode;
    }

    /**
     * Returns additional diagnostic information.
     */
    public String getDiagnostics() {
        return diagnostics;
    }
}
