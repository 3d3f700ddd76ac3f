package org.clinidex.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable table of search rules, keyed by document type.
 * <p>
 * Common rules apply to every type, including types with no entry of their own.
 * A type-specific rule with the same name as a common rule replaces it for that type.
 * Adding a type means building a registry with one more entry; nothing is mutated
 * after {@link Builder#build()}.
 * </p>
 */
public final class SearchRuleRegistry {

    private final Map<String, SearchRule> common;
    private final Map<String, Map<String, SearchRule>> byType;

    private SearchRuleRegistry(Map<String, SearchRule> common, Map<String, Map<String, SearchRule>> byType) {
        this.common = Collections.unmodifiableMap(new LinkedHashMap<>(common));
        Map<String, Map<String, SearchRule>> copy = new LinkedHashMap<>();
        byType.forEach((type, rules) -> copy.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(rules))));
        this.byType = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SearchRuleRegistry empty() {
        return builder().build();
    }

    /**
     * Returns every rule that applies to a type, common rules first, in declaration order.
     */
    public List<SearchRule> rulesFor(String type) {
        Map<String, SearchRule> specific = byType.getOrDefault(type, Map.of());
        List<SearchRule> rules = new ArrayList<>();
        for (SearchRule rule : common.values()) {
            if (!specific.containsKey(rule.name())) {
                rules.add(rule);
            }
        }
        rules.addAll(specific.values());
        return rules;
    }

    public Optional<SearchRule> find(String type, String name) {
        SearchRule rule = byType.getOrDefault(type, Map.of()).get(name);
        return Optional.ofNullable(rule != null ? rule : common.get(name));
    }

    /**
     * Returns the types with their own rules, sorted.
     */
    public Set<String> types() {
        return Collections.unmodifiableSet(new TreeSet<>(byType.keySet()));
    }

    /**
     * Returns the types that declare a parameter of the given name, sorted.
     */
    public Set<String> typesDefining(String name) {
        Set<String> types = new TreeSet<>();
        byType.forEach((type, rules) -> {
            if (rules.containsKey(name) || common.containsKey(name)) {
                types.add(type);
            }
        });
        return types;
    }

    public Map<String, SearchRule> commonRules() {
        return common;
    }

    public int ruleCount() {
        return common.size() + byType.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return ruleCount() == 0;
    }

    public static final class Builder {

        private final Map<String, SearchRule> common = new LinkedHashMap<>();
        private final Map<String, Map<String, SearchRule>> byType = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder common(SearchRule rule) {
            common.put(rule.name(), rule);
            return this;
        }

        public Builder rule(String type, SearchRule rule) {
            byType.computeIfAbsent(type, t -> new LinkedHashMap<>()).put(rule.name(), rule);
            return this;
        }

        public Builder rules(String type, List<SearchRule> rules) {
            rules.forEach(rule -> rule(type, rule));
            return this;
        }

        public SearchRuleRegistry build() {
            return new SearchRuleRegistry(common, byType);
        }
    }
}
