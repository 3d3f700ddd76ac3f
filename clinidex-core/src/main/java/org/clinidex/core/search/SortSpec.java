package org.clinidex.core.search;

/**
 * One sort key; {@code -date} sorts descending.
 */
public record SortSpec(String parameter, boolean descending) {

    public static SortSpec parse(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("-")) {
            return new SortSpec(trimmed.substring(1), true);
        }
        return new SortSpec(trimmed, false);
    }

    public static SortSpec ascending(String parameter) {
        return new SortSpec(parameter, false);
    }

    public static SortSpec descending(String parameter) {
        return new SortSpec(parameter, true);
    }
}
