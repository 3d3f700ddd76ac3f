package org.clinidex.core.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.clinidex.core.reference.CanonicalRef;
import org.clinidex.core.rules.ParameterKind;

import java.math.BigDecimal;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns a JSON value reached by a rule path into index rows of the rule's kind.
 */
class ValueConverter {

    private final Function<String, Optional<CanonicalRef>> referenceParser;

    ValueConverter(Function<String, Optional<CanonicalRef>> referenceParser) {
        this.referenceParser = referenceParser;
    }

    List<IndexRow> convert(String parameter, ParameterKind kind, JsonNode node) {
        return switch (kind) {
            case STRING -> strings(parameter, node);
            case NUMBER -> numbers(parameter, node);
            case DATE -> dates(parameter, node);
            case TOKEN -> tokens(parameter, node);
            case REFERENCE -> references(parameter, node);
            case COMPOSITE -> throw new IllegalStateException("Composite values are converted per component");
        };
    }

    private List<IndexRow> strings(String parameter, JsonNode node) {
        if (node.isValueNode()) {
            return List.of(IndexRow.string(parameter, node.asText()));
        }
        // Structured strings such as names and addresses index every text part
        Set<String> parts = new LinkedHashSet<>();
        collectText(node, parts);
        List<IndexRow> rows = new ArrayList<>(parts.size());
        for (String part : parts) {
            rows.add(IndexRow.string(parameter, part));
        }
        return rows;
    }

    private void collectText(JsonNode node, Set<String> parts) {
        if (node.isTextual()) {
            if (!node.asText().isBlank()) {
                parts.add(node.asText());
            }
        } else if (node.isContainerNode()) {
            for (JsonNode child : node) {
                collectText(child, parts);
            }
        }
    }

    private List<IndexRow> numbers(String parameter, JsonNode node) {
        if (node.isNumber()) {
            return List.of(IndexRow.number(parameter, node.decimalValue()));
        }
        if (node.isTextual()) {
            try {
                return List.of(IndexRow.number(parameter, new BigDecimal(node.asText().trim())));
            } catch (NumberFormatException e) {
                throw new UnconvertibleValueException("Not a number: '" + node.asText() + "'", e);
            }
        }
        if (node.isObject()) {
            JsonNode value = node.get("value");
            return value == null || value.isNull() ? List.of() : numbers(parameter, value);
        }
        throw new UnconvertibleValueException("Cannot index " + node.getNodeType() + " as a number");
    }

    private List<IndexRow> dates(String parameter, JsonNode node) {
        try {
            if (node.isTextual()) {
                return List.of(IndexRow.date(parameter, DateRange.parse(node.asText())));
            }
            if (node.isObject()) {
                String start = textOrNull(node, "start");
                String end = textOrNull(node, "end");
                if (start == null && end == null) {
                    return List.of();
                }
                return List.of(IndexRow.date(parameter, DateRange.period(start, end)));
            }
        } catch (DateTimeParseException e) {
            throw new UnconvertibleValueException("Not a date: " + e.getParsedString(), e);
        }
        throw new UnconvertibleValueException("Cannot index " + node.getNodeType() + " as a date");
    }

    private List<IndexRow> tokens(String parameter, JsonNode node) {
        if (node.isTextual() || node.isNumber()) {
            return List.of(IndexRow.token(parameter, null, node.asText()));
        }
        if (node.isBoolean()) {
            return List.of(IndexRow.token(parameter, null, node.booleanValue() ? "true" : "false"));
        }
        if (!node.isObject()) {
            throw new UnconvertibleValueException("Cannot index " + node.getNodeType() + " as a token");
        }

        List<IndexRow> rows = new ArrayList<>();
        JsonNode codings = node.get("coding");
        if (codings != null && codings.isArray()) {
            for (JsonNode coding : codings) {
                String code = textOrNull(coding, "code");
                if (code != null) {
                    rows.add(IndexRow.token(parameter, textOrNull(coding, "system"), code));
                }
            }
            return rows;
        }

        String code = textOrNull(node, "code");
        if (code != null) {
            return List.of(IndexRow.token(parameter, textOrNull(node, "system"), code));
        }
        // Identifier, ContactPoint: system plus value
        String value = textOrNull(node, "value");
        if (value != null) {
            return List.of(IndexRow.token(parameter, textOrNull(node, "system"), value));
        }
        return rows;
    }

    private List<IndexRow> references(String parameter, JsonNode node) {
        String raw;
        if (node.isTextual()) {
            raw = node.asText();
        } else if (node.isObject()) {
            raw = textOrNull(node, "reference");
        } else {
            throw new UnconvertibleValueException("Cannot index " + node.getNodeType() + " as a reference");
        }
        if (raw == null) {
            return List.of();
        }
        return referenceParser.apply(raw)
                .map(ref -> List.of(IndexRow.reference(parameter, ref)))
                .orElse(List.of());
    }

    static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
