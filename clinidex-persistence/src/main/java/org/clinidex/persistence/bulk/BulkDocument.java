package org.clinidex.persistence.bulk;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One document to write in a bulk import.
 *
 * @param type            the document type
 * @param id              the document id, or null for a generated one
 * @param body            the JSON object to store
 * @param expectedVersion the expected current version, or null to skip the check
 */
public record BulkDocument(String type, String id, JsonNode body, Integer expectedVersion) {

    public static BulkDocument of(String type, String id, JsonNode body) {
        return new BulkDocument(type, id, body, null);
    }
}
