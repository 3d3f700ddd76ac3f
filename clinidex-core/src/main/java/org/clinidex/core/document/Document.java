package org.clinidex.core.document;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * One version of a stored document.
 *
 * @param type      the schema family, e.g. {@code Observation}
 * @param id        unique within {@code type}
 * @param version   starts at 1 and grows by one on every write of the key
 * @param updatedAt when this version was written
 * @param deleted   true for a soft-delete tombstone
 * @param body      the document exactly as written; empty for a tombstone
 */
public record Document(
        String type,
        String id,
        int version,
        Instant updatedAt,
        boolean deleted,
        ObjectNode body
) {

    /**
     * Returns the composite key, {@code type/id}.
     */
    public String key() {
        return type + "/" + id;
    }
}
