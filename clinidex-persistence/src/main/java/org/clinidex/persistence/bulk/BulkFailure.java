package org.clinidex.persistence.bulk;

/**
 * A document of a bulk import that was not written.
 *
 * @param index     position of the document in the import
 * @param type      the document type
 * @param id        the document id, null when it was to be generated
 * @param issueCode the issue code of the failure, e.g. {@code conflict}
 * @param message   what went wrong
 */
public record BulkFailure(int index, String type, String id, String issueCode, String message) {
}
