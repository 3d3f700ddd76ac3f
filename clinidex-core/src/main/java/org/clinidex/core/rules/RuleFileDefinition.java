package org.clinidex.core.rules;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of one rule file: the rules of one document type, or the common rules.
 */
@Getter
@Setter
@NoArgsConstructor
public class RuleFileDefinition {

    private String resourceType;
    private boolean common;
    private List<RuleDefinition> parameters = new ArrayList<>();
}
