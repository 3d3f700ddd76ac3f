package org.clinidex.core.rules;

import java.util.List;
import java.util.Optional;

/**
 * Declares how one search parameter is extracted from documents of a type.
 *
 * @param name       the parameter name used in queries
 * @param kind       the kind of value indexed
 * @param path       where the values live in the document
 * @param repeating  when false only the first value reached is indexed
 * @param targets    for references, the document types the pointer may lead to
 * @param components for composites, the co-located parts of each occurrence
 */
public record SearchRule(
        String name,
        ParameterKind kind,
        PathExpression path,
        boolean repeating,
        List<String> targets,
        List<CompositeComponent> components
) {

    public SearchRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Search rule name is required");
        }
        if (kind == null || path == null) {
            throw new IllegalArgumentException("Search rule '" + name + "' needs a kind and a path");
        }
        targets = targets != null ? List.copyOf(targets) : List.of();
        components = components != null ? List.copyOf(components) : List.of();
        if (kind == ParameterKind.COMPOSITE && components.size() < 2) {
            throw new IllegalArgumentException("Composite rule '" + name + "' needs at least two components");
        }
        if (kind != ParameterKind.COMPOSITE && !components.isEmpty()) {
            throw new IllegalArgumentException("Only composite rules have components: " + name);
        }
    }

    public static SearchRule of(String name, ParameterKind kind, String path) {
        return new SearchRule(name, kind, PathExpression.parse(path), true, List.of(), List.of());
    }

    public static SearchRule reference(String name, String path, String... targets) {
        return new SearchRule(name, ParameterKind.REFERENCE, PathExpression.parse(path), true, List.of(targets), List.of());
    }

    public static SearchRule composite(String name, String path, CompositeComponent... components) {
        return new SearchRule(name, ParameterKind.COMPOSITE, PathExpression.parse(path), true, List.of(), List.of(components));
    }

    public SearchRule singleValued() {
        return new SearchRule(name, kind, path, false, targets, components);
    }

    public Optional<CompositeComponent> component(String componentName) {
        return components.stream().filter(c -> c.name().equals(componentName)).findFirst();
    }
}
