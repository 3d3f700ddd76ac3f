package org.clinidex.core.document;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Immutable record of one version of a document, as kept by the history ledger.
 */
public record HistoryEntry(
        String type,
        String id,
        int version,
        HistoryOperation operation,
        ObjectNode body,
        Instant writtenAt
) {

    /**
     * Views this entry as the document version it recorded.
     */
    public Document toDocument() {
        return new Document(type, id, version, writtenAt, operation == HistoryOperation.DELETE, body);
    }
}
