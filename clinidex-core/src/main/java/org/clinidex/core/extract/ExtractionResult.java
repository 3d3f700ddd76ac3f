package org.clinidex.core.extract;

import java.util.List;

/**
 * Everything derived from one document: its index rows and its outbound edges.
 */
public record ExtractionResult(List<IndexRow> rows, List<ReferenceEdge> edges) {

    private static final ExtractionResult EMPTY = new ExtractionResult(List.of(), List.of());

    public ExtractionResult {
        rows = List.copyOf(rows);
        edges = List.copyOf(edges);
    }

    public static ExtractionResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rows.isEmpty() && edges.isEmpty();
    }
}
