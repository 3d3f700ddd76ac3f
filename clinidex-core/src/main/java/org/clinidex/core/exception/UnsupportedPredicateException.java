package org.clinidex.core.exception;

/**
 * Exception thrown when a query names a parameter, modifier or value form
 * that is not registered for the searched type.
 */
public class UnsupportedPredicateException extends ClinidexException {

    private final String resourceType;
    private final String parameter;
    private final String modifier;

    public UnsupportedPredicateException(String resourceType, String parameter, String modifier, String reason) {
        super(String.format("Unsupported search on %s: %s%s", resourceType, parameter,
                        modifier != null ? ":" + modifier : ""),
                "not-supported",
                reason);
        this.resourceType = resourceType;
        this.parameter = parameter;
        this.modifier = modifier;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getParameter() {
        return parameter;
    }

    public String getModifier() {
        return modifier;
    }
}
