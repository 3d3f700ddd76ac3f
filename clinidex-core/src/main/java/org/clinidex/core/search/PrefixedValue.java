package org.clinidex.core.search;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A number or date query value with its comparator split off.
 * A prefix written in the value wins over the predicate's own comparator.
 */
public record PrefixedValue(SearchComparator comparator, String value) {

    private static final Pattern PREFIX_PATTERN = Pattern.compile("^(eq|ne|lt|gt|le|ge)(.+)$");

    public static PrefixedValue parse(String raw, SearchComparator fallback) {
        Matcher matcher = PREFIX_PATTERN.matcher(raw.trim());
        if (matcher.matches()) {
            return new PrefixedValue(SearchComparator.fromPrefix(matcher.group(1)).orElseThrow(), matcher.group(2));
        }
        return new PrefixedValue(fallback != null ? fallback : SearchComparator.EQ, raw.trim());
    }
}
