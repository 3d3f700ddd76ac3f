package org.clinidex.core.document;

/**
 * The kind of write that produced a history entry.
 */
public enum HistoryOperation {

    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String code;

    HistoryOperation(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
