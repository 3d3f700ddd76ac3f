package org.clinidex.core.rules;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of a single search rule, or of a composite's component.
 */
@Getter
@Setter
@NoArgsConstructor
public class RuleDefinition {

    private String name;
    private String kind;
    private String path;
    private Boolean repeating;
    private List<String> targets = new ArrayList<>();
    private List<RuleDefinition> components = new ArrayList<>();

    SearchRule toRule() {
        ParameterKind parameterKind = ParameterKind.fromCode(kind);
        List<CompositeComponent> parts = new ArrayList<>();
        if (components != null) {
            for (RuleDefinition component : components) {
                parts.add(new CompositeComponent(component.getName(),
                        ParameterKind.fromCode(component.getKind()),
                        PathExpression.parse(component.getPath())));
            }
        }
        return new SearchRule(name, parameterKind, PathExpression.parse(path),
                repeating == null || repeating, targets, parts);
    }
}
