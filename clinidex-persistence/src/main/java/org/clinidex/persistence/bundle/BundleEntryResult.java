package org.clinidex.persistence.bundle;

import org.clinidex.core.document.Document;
import org.clinidex.core.search.SearchResult;

/**
 * Outcome of one bundle entry.
 *
 * @param status       HTTP-style status line, e.g. {@code 201 Created}
 * @param location     {@code Type/id/_history/version} of the written version, if any
 * @param version      the version written or read, if any
 * @param document     the document written or read, if any
 * @param searchResult the result of a search entry, if any
 * @param error        the failure message of a batch entry, if it failed
 */
public record BundleEntryResult(
        String status,
        String location,
        Integer version,
        Document document,
        SearchResult searchResult,
        String error
) {

    static BundleEntryResult written(String status, Document document) {
        return new BundleEntryResult(status,
                document.type() + "/" + document.id() + "/_history/" + document.version(),
                document.version(), document, null, null);
    }

    static BundleEntryResult read(Document document) {
        return new BundleEntryResult("200 OK", null, document.version(), document, null, null);
    }

    static BundleEntryResult searched(SearchResult result) {
        return new BundleEntryResult("200 OK", null, null, null, result, null);
    }

    static BundleEntryResult failed(String status, String error) {
        return new BundleEntryResult(status, null, null, null, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
