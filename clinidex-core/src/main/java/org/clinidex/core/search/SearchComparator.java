package org.clinidex.core.search;

import java.util.Optional;

/**
 * Comparators for ordered kinds, written as value prefixes such as {@code ge2020}.
 */
public enum SearchComparator {

    EQ("eq"),
    NE("ne"),
    GT("gt"),
    LT("lt"),
    GE("ge"),
    LE("le");

    private final String prefix;

    SearchComparator(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static Optional<SearchComparator> fromPrefix(String prefix) {
        for (SearchComparator comparator : values()) {
            if (comparator.prefix.equals(prefix)) {
                return Optional.of(comparator);
            }
        }
        return Optional.empty();
    }
}
