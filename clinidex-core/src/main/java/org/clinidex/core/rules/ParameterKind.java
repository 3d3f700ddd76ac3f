package org.clinidex.core.rules;

/**
 * The value kinds a search parameter can index.
 */
public enum ParameterKind {

    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    TOKEN("token"),
    REFERENCE("reference"),
    COMPOSITE("composite");

    private final String code;

    ParameterKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a kind from its code, case-insensitively.
     *
     * @throws IllegalArgumentException if the code names no kind
     */
    public static ParameterKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Parameter kind is required");
        }
        for (ParameterKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown parameter kind: " + code);
    }
}
