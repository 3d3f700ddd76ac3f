package org.clinidex.persistence.health;

import org.clinidex.core.config.ClinidexProperties;
import org.clinidex.core.rules.SearchRuleRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the search rule registry.
 * Reports DOWN when no rules were loaded, since nothing written would be searchable.
 */
@Component
public class RuleRegistryHealthIndicator implements HealthIndicator {

    private final SearchRuleRegistry registry;
    private final ClinidexProperties properties;

    public RuleRegistryHealthIndicator(SearchRuleRegistry registry, ClinidexProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("location", properties.getRules().getLocation());
        details.put("types", registry.types().size());
        details.put("rules", registry.ruleCount());
        details.put("commonRules", registry.commonRules().size());
        details.put("resolveUntyped", properties.getReferences().isResolveUntyped());

        if (registry.isEmpty()) {
            details.put("reason", "No search rules loaded");
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
