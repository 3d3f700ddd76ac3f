package org.clinidex.core.search;

import org.clinidex.core.exception.UnsupportedPredicateException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates query-string style parameters into a {@link SearchRequest}.
 * <p>
 * Keys may carry a modifier ({@code name:exact}, {@code subject:Patient}); values may be
 * comma-separated alternatives, with {@code \,} for a literal comma. Control parameters
 * {@code _sort}, {@code _count}, {@code _offset}, {@code _include} and {@code _revinclude}
 * shape the request instead of filtering it.
 * </p>
 */
public class SearchQueryParser {

    // Presentation parameters that don't affect the result set
    private static final Set<String> IGNORED_PARAMS = Set.of(
            "_format", "_pretty", "_summary", "_elements", "_total"
    );

    public SearchRequest parse(String type, Map<String, List<String>> params) {
        SearchRequest.SearchRequestBuilder builder = SearchRequest.builder().type(type);
        List<SearchPredicate> predicates = new ArrayList<>();
        List<SortSpec> sort = new ArrayList<>();
        List<IncludeSpec> includes = new ArrayList<>();
        List<IncludeSpec> revIncludes = new ArrayList<>();

        for (Map.Entry<String, List<String>> entry : params.entrySet()) {
            String key = entry.getKey();
            for (String raw : entry.getValue()) {
                if (raw == null) {
                    continue;
                }
                switch (key) {
                    case "_sort" -> splitValues(raw).forEach(v -> sort.add(SortSpec.parse(v)));
                    case "_count" -> builder.limit(parseInt(type, key, raw));
                    case "_offset" -> builder.offset(parseInt(type, key, raw));
                    case "_include" -> includes.add(parseInclude(type, key, raw));
                    case "_revinclude" -> revIncludes.add(parseInclude(type, key, raw));
                    default -> {
                        if (!IGNORED_PARAMS.contains(key)) {
                            predicates.add(toPredicate(key, raw));
                        }
                    }
                }
            }
        }

        return builder.predicates(predicates)
                .sort(sort)
                .includes(includes)
                .revIncludes(revIncludes)
                .build();
    }

    /**
     * Parses a raw query string such as {@code name=smith&birthdate=ge1970}.
     */
    public SearchRequest parseQueryString(String type, String query) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (query != null && !query.isBlank()) {
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = decode(eq < 0 ? pair : pair.substring(0, eq));
                String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
                params.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            }
        }
        return parse(type, params);
    }

    static SearchPredicate toPredicate(String key, String raw) {
        String[] split = splitModifier(key);
        return new SearchPredicate(split[0], split[1], SearchComparator.EQ, splitValues(raw));
    }

    /**
     * Splits {@code key} into parameter and modifier. The modifier belongs to the last
     * parameter of a chain, so {@code subject:Patient.name:exact} keeps the type filter
     * inside the chain and yields the modifier {@code exact}.
     */
    static String[] splitModifier(String key) {
        if (key.startsWith("_has:")) {
            String[] parts = key.split(":", 4);
            if (parts.length == 4) {
                String[] inner = splitModifier(parts[3]);
                return new String[]{parts[0] + ":" + parts[1] + ":" + parts[2] + ":" + inner[0], inner[1]};
            }
            return new String[]{key, null};
        }
        int lastDot = key.lastIndexOf('.');
        String segment = key.substring(lastDot + 1);
        int colon = segment.indexOf(':');
        if (colon < 0) {
            return new String[]{key, null};
        }
        return new String[]{key.substring(0, lastDot + 1 + colon), segment.substring(colon + 1)};
    }

    static List<String> splitValues(String raw) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length() && raw.charAt(i + 1) == ',') {
                current.append(',');
                i++;
            } else if (c == ',') {
                values.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        values.add(current.toString());
        values.removeIf(String::isEmpty);
        return values;
    }

    private static int parseInt(String type, String key, String raw) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new UnsupportedPredicateException(type, key, null, "Must not be negative: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new UnsupportedPredicateException(type, key, null, "Not an integer: " + raw);
        }
    }

    private static IncludeSpec parseInclude(String type, String key, String raw) {
        try {
            return IncludeSpec.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedPredicateException(type, key, null, e.getMessage());
        }
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
