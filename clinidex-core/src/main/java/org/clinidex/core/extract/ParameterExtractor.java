package org.clinidex.core.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.clinidex.core.exception.ExtractionFailureException;
import org.clinidex.core.reference.CanonicalRef;
import org.clinidex.core.reference.ReferenceNormalizer;
import org.clinidex.core.reference.UntypedReferenceResolver;
import org.clinidex.core.rules.CompositeComponent;
import org.clinidex.core.rules.ParameterKind;
import org.clinidex.core.rules.SearchRule;
import org.clinidex.core.rules.SearchRuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives index rows and reference edges from a document, driven by a rule registry.
 * <p>
 * Extraction is total: a type without rules yields only the common rules' rows, and a
 * rule whose path is absent from a document yields nothing. It fails only when a value
 * is present but cannot be read as the rule's kind. Output order follows rule order and
 * then document order, so extracting the same document twice gives equal results.
 * </p>
 */
public class ParameterExtractor {

    private static final Logger log = LoggerFactory.getLogger(ParameterExtractor.class);

    private static final String REFERENCE_FIELD = "reference";

    private final SearchRuleRegistry registry;
    private final ReferenceNormalizer normalizer;
    private final UntypedReferenceResolver resolver;
    private final ValueConverter converter;

    public ParameterExtractor(SearchRuleRegistry registry, ReferenceNormalizer normalizer,
                              UntypedReferenceResolver resolver) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.resolver = resolver != null ? resolver : UntypedReferenceResolver.NONE;
        this.converter = new ValueConverter(this::canonicalize);
    }

    public ParameterExtractor(SearchRuleRegistry registry, ReferenceNormalizer normalizer) {
        this(registry, normalizer, UntypedReferenceResolver.NONE);
    }

    /**
     * Extracts the index rows and reference edges of one document.
     *
     * @param type the document type, which selects the rules
     * @param body the document body
     * @return the derived rows and edges, empty for a missing or non-object body
     * @throws ExtractionFailureException if a rule meets a value it cannot convert
     */
    public ExtractionResult extract(String type, JsonNode body) {
        if (body == null || !body.isObject()) {
            return ExtractionResult.empty();
        }

        List<IndexRow> rows = new ArrayList<>();
        List<Map.Entry<SearchRule, List<IndexRow>>> referenceRows = new ArrayList<>();
        for (SearchRule rule : registry.rulesFor(type)) {
            try {
                List<IndexRow> ruleRows = extractRule(rule, body);
                rows.addAll(ruleRows);
                if (rule.kind() == ParameterKind.REFERENCE && rule.components().isEmpty()) {
                    referenceRows.add(Map.entry(rule, ruleRows));
                }
            } catch (UnconvertibleValueException e) {
                throw new ExtractionFailureException(type, rule.name(),
                        String.format("Path '%s': %s", rule.path(), e.getMessage()), e);
            }
        }

        List<ReferenceEdge> edges = new ArrayList<>();
        collectEdges(body, "", edges);
        referenceRows.forEach(entry -> addRuleEdges(entry.getKey(), entry.getValue(), edges));

        log.debug("Extracted {} index rows and {} reference edges from {}", rows.size(), edges.size(), type);
        return new ExtractionResult(rows, edges);
    }

    public SearchRuleRegistry getRegistry() {
        return registry;
    }

    private List<IndexRow> extractRule(SearchRule rule, JsonNode body) {
        List<JsonNode> values = rule.path().evaluate(body);
        List<IndexRow> rows = new ArrayList<>();

        if (rule.components().isEmpty()) {
            for (JsonNode value : values) {
                rows.addAll(converter.convert(rule.name(), rule.kind(), value));
                if (!rule.repeating() && !rows.isEmpty()) {
                    return List.of(rows.get(0));
                }
            }
            return rows;
        }

        int occurrence = 0;
        for (JsonNode element : values) {
            String occurrenceKey = rule.name() + "#" + occurrence++;
            int before = rows.size();
            for (CompositeComponent component : rule.components()) {
                for (JsonNode part : component.path().evaluate(element)) {
                    for (IndexRow row : converter.convert(component.name(), component.kind(), part)) {
                        rows.add(row.asComponent(rule.name(), component.name(), occurrenceKey));
                    }
                }
            }
            if (!rule.repeating() && rows.size() > before) {
                return rows;
            }
        }
        return rows;
    }

    private void collectEdges(JsonNode node, String path, List<ReferenceEdge> edges) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                collectEdges(element, path, edges);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }

        JsonNode pointer = node.get(REFERENCE_FIELD);
        if (pointer != null && pointer.isTextual()) {
            canonicalize(pointer.asText()).ifPresent(ref -> edges.add(ReferenceEdge.of(ref, path)));
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isContainerNode()) {
                collectEdges(field.getValue(), path.isEmpty() ? field.getKey() : path + "." + field.getKey(), edges);
            }
        }
    }

    /**
     * Pointers held as bare strings ({@code "parent": "p1"}) have no {@code reference} object
     * for {@link #collectEdges} to find; the rule that indexed them supplies the field path.
     */
    private void addRuleEdges(SearchRule rule, List<IndexRow> ruleRows, List<ReferenceEdge> edges) {
        Set<String> fieldPaths = rule.path().fieldPaths();
        if (fieldPaths.isEmpty()) {
            return;
        }
        String fieldPath = fieldPaths.iterator().next();
        for (IndexRow row : ruleRows) {
            boolean covered = edges.stream().anyMatch(edge -> fieldPaths.contains(edge.fieldPath())
                    && Objects.equals(edge.targetType(), row.referenceType())
                    && edge.targetId().equals(row.referenceId()));
            if (!covered) {
                edges.add(new ReferenceEdge(row.referenceType(), row.referenceId(), fieldPath));
            }
        }
    }

    private Optional<CanonicalRef> canonicalize(String raw) {
        return normalizer.normalize(raw, resolver);
    }
}
