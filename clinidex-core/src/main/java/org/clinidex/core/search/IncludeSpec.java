package org.clinidex.core.search;

/**
 * An include directive, {@code SourceType:parameter[:TargetType]}.
 * <p>
 * As {@code _include} it pulls in documents that the matches point at through the
 * parameter; as {@code _revinclude} it pulls in documents of the source type that
 * point at the matches.
 * </p>
 */
public record IncludeSpec(String sourceType, String parameter, String targetType) {

    /**
     * @throws IllegalArgumentException when the directive lacks a type or parameter
     */
    public static IncludeSpec parse(String value) {
        String[] parts = value.trim().split(":");
        if (parts.length < 2 || parts.length > 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new IllegalArgumentException("Include must read Type:parameter[:TargetType], got '" + value + "'");
        }
        return new IncludeSpec(parts[0], parts[1], parts.length == 3 ? parts[2] : null);
    }
}
