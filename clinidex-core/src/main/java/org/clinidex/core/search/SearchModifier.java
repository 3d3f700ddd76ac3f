package org.clinidex.core.search;

/**
 * Parameter modifiers understood by the planner. A capitalized modifier, as in
 * {@code subject:Patient}, restricts a reference to one target type.
 */
public enum SearchModifier {

    NONE,
    EXACT,
    CONTAINS,
    MISSING,
    NOT,
    TYPE;

    /**
     * Classifies a raw modifier string.
     *
     * @throws IllegalArgumentException for an unknown modifier
     */
    public static SearchModifier parse(String modifier) {
        if (modifier == null || modifier.isEmpty()) {
            return NONE;
        }
        if (Character.isUpperCase(modifier.charAt(0))) {
            return TYPE;
        }
        return switch (modifier) {
            case "exact" -> EXACT;
            case "contains" -> CONTAINS;
            case "missing" -> MISSING;
            case "not" -> NOT;
            default -> throw new IllegalArgumentException("Unknown modifier: " + modifier);
        };
    }
}
