package org.clinidex.core.rules;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A field path into a JSON document, interpreted against each document written.
 * <p>
 * Grammar:
 * <pre>
 *   path    := step ('.' step)*
 *   step    := name ['[*]'] | '(' path ('|' path)* ')' ['[*]']
 * </pre>
 * A {@code name} step descends into an object field. Arrays met on the way are
 * always flattened, so every element yields its own value; {@code [*]} only makes
 * that explicit. A parenthesized step takes the first alternative that yields
 * anything, for fields that encode a union such as {@code (valueQuantity|valueInteger)}.
 * </p>
 */
public final class PathExpression {

    private final String source;
    private final List<Step> steps;

    private PathExpression(String source, List<Step> steps) {
        this.source = source;
        this.steps = List.copyOf(steps);
    }

    /**
     * Parses a path expression.
     *
     * @throws IllegalArgumentException if the text is not a valid path
     */
    public static PathExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Path expression must not be empty");
        }
        Parser parser = new Parser(text.replace(" ", ""));
        PathExpression path = parser.parsePath();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException(String.format(
                    "Unexpected '%s' at position %d in path '%s'",
                    parser.text.charAt(parser.pos), parser.pos, text));
        }
        return path;
    }

    /**
     * Evaluates this path against a node and returns every value it reaches, in document order.
     * Absent fields and JSON nulls yield nothing.
     */
    public List<JsonNode> evaluate(JsonNode root) {
        List<JsonNode> current = new ArrayList<>();
        addFlattened(current, root);
        for (Step step : steps) {
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode node : current) {
                if (step instanceof Field field) {
                    if (node.isObject()) {
                        addFlattened(next, node.get(field.name()));
                    }
                } else if (step instanceof FirstOf firstOf) {
                    for (PathExpression alternative : firstOf.alternatives()) {
                        List<JsonNode> values = alternative.evaluate(node);
                        if (!values.isEmpty()) {
                            next.addAll(values);
                            break;
                        }
                    }
                }
            }
            if (next.isEmpty()) {
                return Collections.emptyList();
            }
            current = next;
        }
        return current;
    }

    /**
     * Returns the dotted field paths this expression can reach, one per combination of
     * alternatives. A trailing {@code reference} field is dropped, so the result names
     * the object that holds the pointer, the way reference edges record it.
     */
    public Set<String> fieldPaths() {
        Set<String> prefixes = new LinkedHashSet<>();
        prefixes.add("");
        for (Step step : steps) {
            Set<String> next = new LinkedHashSet<>();
            for (String prefix : prefixes) {
                if (step instanceof Field field) {
                    next.add(join(prefix, field.name()));
                } else if (step instanceof FirstOf firstOf) {
                    for (PathExpression alternative : firstOf.alternatives()) {
                        for (String suffix : alternative.fieldPaths()) {
                            next.add(join(prefix, suffix));
                        }
                    }
                }
            }
            prefixes = next;
        }
        Set<String> result = new LinkedHashSet<>();
        for (String path : prefixes) {
            result.add(path.endsWith(".reference") ? path.substring(0, path.length() - ".reference".length()) : path);
        }
        return Collections.unmodifiableSet(result);
    }

    public String source() {
        return source;
    }

    private static String join(String prefix, String name) {
        return prefix.isEmpty() ? name : prefix + "." + name;
    }

    private static void addFlattened(List<JsonNode> target, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                addFlattened(target, element);
            }
        } else {
            target.add(node);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathExpression that)) return false;
        return source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source);
    }

    @Override
    public String toString() {
        return source;
    }

    private sealed interface Step permits Field, FirstOf {
    }

    private record Field(String name) implements Step {
    }

    private record FirstOf(List<PathExpression> alternatives) implements Step {
    }

    private static final class Parser {

        private final String text;
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        PathExpression parsePath() {
            int start = pos;
            List<Step> steps = new ArrayList<>();
            steps.add(parseStep());
            while (consume('.')) {
                steps.add(parseStep());
            }
            return new PathExpression(text.substring(start, pos), steps);
        }

        private Step parseStep() {
            if (consume('(')) {
                List<PathExpression> alternatives = new ArrayList<>();
                alternatives.add(parsePath());
                while (consume('|')) {
                    alternatives.add(parsePath());
                }
                if (!consume(')')) {
                    throw new IllegalArgumentException("Unclosed alternative group in path '" + text + "'");
                }
                consumeEach();
                return new FirstOf(List.copyOf(alternatives));
            }

            int start = pos;
            while (!atEnd() && isNameChar(text.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException(String.format(
                        "Expected a field name at position %d in path '%s'", pos, text));
            }
            String name = text.substring(start, pos);
            consumeEach();
            return new Field(name);
        }

        private void consumeEach() {
            if (text.startsWith("[*]", pos)) {
                pos += 3;
            }
        }

        private boolean consume(char expected) {
            if (!atEnd() && text.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private static boolean isNameChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-';
        }
    }
}
