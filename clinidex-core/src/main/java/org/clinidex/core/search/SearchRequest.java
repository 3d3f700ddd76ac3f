package org.clinidex.core.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A structured search over one document type.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class SearchRequest {

    private final String type;

    @Builder.Default
    private final List<SearchPredicate> predicates = List.of();

    @Builder.Default
    private final List<SortSpec> sort = List.of();

    /**
     * Page size; null means the configured default.
     */
    private final Integer limit;

    private final int offset;

    @Builder.Default
    private final List<IncludeSpec> includes = List.of();

    @Builder.Default
    private final List<IncludeSpec> revIncludes = List.of();

    /**
     * When true, soft-deleted documents are matched as well.
     */
    private final boolean includeDeleted;

    public static SearchRequest of(String type, SearchPredicate... predicates) {
        return builder().type(type).predicates(List.of(predicates)).build();
    }
}
