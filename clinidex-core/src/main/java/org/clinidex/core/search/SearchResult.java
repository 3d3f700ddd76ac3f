package org.clinidex.core.search;

import org.clinidex.core.document.Document;

import java.util.List;

/**
 * One page of matching documents.
 *
 * @param matches  the page, in result order
 * @param included documents pulled in by include directives, none of them also a match
 * @param total    the number of matching documents across all pages
 */
public record SearchResult(List<Document> matches, List<Document> included, long total) {

    public SearchResult {
        matches = List.copyOf(matches);
        included = List.copyOf(included);
    }

    public List<String> matchIds() {
        return matches.stream().map(Document::id).toList();
    }
}
