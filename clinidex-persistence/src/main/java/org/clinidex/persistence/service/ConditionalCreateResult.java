package org.clinidex.persistence.service;

import org.clinidex.core.document.Document;

/**
 * Outcome of a conditional create.
 *
 * @param document the version just written, or the existing document the criteria matched
 * @param created  false when an existing document was returned and nothing was written
 */
public record ConditionalCreateResult(Document document, boolean created) {
}
