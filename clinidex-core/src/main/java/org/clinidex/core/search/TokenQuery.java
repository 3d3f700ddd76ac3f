package org.clinidex.core.search;

/**
 * A token query value: {@code code}, {@code system|code}, {@code |code} or {@code system|}.
 *
 * @param system         the system to match, or null
 * @param code           the code to match, or null when only the system is constrained
 * @param requireNoSystem true for {@code |code}, which only matches rows without a system
 */
public record TokenQuery(String system, String code, boolean requireNoSystem) {

    public static TokenQuery parse(String value) {
        // Escaped pipes belong to the code or system
        String processed = value.replace("\\|", "\u0000");
        int pipe = processed.indexOf('|');
        if (pipe < 0) {
            return new TokenQuery(null, unescape(processed), false);
        }
        String system = unescape(processed.substring(0, pipe));
        String code = unescape(processed.substring(pipe + 1));
        return new TokenQuery(
                system.isEmpty() ? null : system,
                code.isEmpty() ? null : code,
                system.isEmpty());
    }

    private static String unescape(String value) {
        return value.replace("\u0000", "|");
    }
}
