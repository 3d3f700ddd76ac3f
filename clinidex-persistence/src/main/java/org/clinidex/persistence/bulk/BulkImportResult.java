package org.clinidex.persistence.bulk;

import org.clinidex.core.document.Document;

import java.util.List;

/**
 * Outcome of a bulk import: the written versions in input order, and the failures.
 */
public record BulkImportResult(List<Document> written, List<BulkFailure> failures) {

    public BulkImportResult {
        written = List.copyOf(written);
        failures = List.copyOf(failures);
    }

    public int succeeded() {
        return written.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
