package org.clinidex.core.search;

/**
 * Structure of a predicate's parameter name.
 */
public sealed interface ParameterPath permits ParameterPath.Simple, ParameterPath.Chain, ParameterPath.Has {

    /**
     * A parameter of the searched type itself.
     */
    record Simple(String name) implements ParameterPath {
    }

    /**
     * {@code reference[:TargetType].rest}: the rest applies to the referenced documents.
     */
    record Chain(String referenceParameter, String targetType, String rest) implements ParameterPath {
    }

    /**
     * {@code _has:SourceType:reference:rest}: the rest applies to documents of the source
     * type that point at the searched document through the reference parameter.
     */
    record Has(String sourceType, String referenceParameter, String rest) implements ParameterPath {
    }

    /**
     * @throws IllegalArgumentException if a reverse chain is missing one of its parts
     */
    static ParameterPath parse(String parameter) {
        if (parameter.startsWith("_has:")) {
            String[] parts = parameter.split(":", 4);
            if (parts.length < 4 || parts[1].isEmpty() || parts[2].isEmpty() || parts[3].isEmpty()) {
                throw new IllegalArgumentException("Reverse chain must read _has:Type:reference:parameter");
            }
            return new Has(parts[1], parts[2], parts[3]);
        }

        int dot = parameter.indexOf('.');
        if (dot > 0 && dot < parameter.length() - 1) {
            String head = parameter.substring(0, dot);
            String rest = parameter.substring(dot + 1);
            int colon = head.indexOf(':');
            if (colon > 0) {
                return new Chain(head.substring(0, colon), head.substring(colon + 1), rest);
            }
            return new Chain(head, null, rest);
        }
        return new Simple(parameter);
    }
}
