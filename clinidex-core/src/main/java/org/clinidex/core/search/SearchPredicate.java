package org.clinidex.core.search;

import java.util.List;

/**
 * One {@code (parameter, modifier, comparator, values)} query tuple.
 * Values are alternatives; predicates of one request must all hold.
 * <p>
 * The parameter may be a chain such as {@code subject.name} or
 * {@code subject:Patient.name}, or a reverse chain such as
 * {@code _has:Observation:subject:code}.
 * </p>
 */
public record SearchPredicate(String parameter, String modifier, SearchComparator comparator, List<String> values) {

    public SearchPredicate {
        if (parameter == null || parameter.isBlank()) {
            throw new IllegalArgumentException("Search parameter is required");
        }
        comparator = comparator != null ? comparator : SearchComparator.EQ;
        values = values != null ? List.copyOf(values) : List.of();
    }

    public static SearchPredicate of(String parameter, String... values) {
        return new SearchPredicate(parameter, null, SearchComparator.EQ, List.of(values));
    }

    public static SearchPredicate modified(String parameter, String modifier, String... values) {
        return new SearchPredicate(parameter, modifier, SearchComparator.EQ, List.of(values));
    }

    public static SearchPredicate compared(String parameter, SearchComparator comparator, String... values) {
        return new SearchPredicate(parameter, null, comparator, List.of(values));
    }

    /**
     * Returns the same predicate aimed at a different parameter, used when walking chains.
     */
    public SearchPredicate withParameter(String newParameter) {
        return new SearchPredicate(newParameter, modifier, comparator, values);
    }
}
