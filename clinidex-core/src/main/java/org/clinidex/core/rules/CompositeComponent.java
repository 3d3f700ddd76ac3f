package org.clinidex.core.rules;

/**
 * One part of a composite parameter, evaluated relative to each occurrence
 * reached by the composite's own path.
 */
public record CompositeComponent(String name, ParameterKind kind, PathExpression path) {

    public CompositeComponent {
        if (kind == ParameterKind.COMPOSITE) {
            throw new IllegalArgumentException("Composite component '" + name + "' cannot itself be composite");
        }
    }
}
