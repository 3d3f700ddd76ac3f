package org.clinidex.core.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Builds a {@link SearchRuleRegistry} from YAML rule files.
 * <p>
 * Every {@code *.yml} file under the configured location holds the rules of one
 * document type ({@code resourceType}) or, with {@code common: true}, rules that
 * apply to every type. An invalid rule fails the load: a rule table that cannot be
 * honored must not silently index less than it declares.
 * </p>
 */
public class SearchRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(SearchRuleLoader.class);

    private final ObjectMapper yamlMapper;
    private final PathMatchingResourcePatternResolver resourceResolver;

    public SearchRuleLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.resourceResolver = new PathMatchingResourcePatternResolver();
    }

    /**
     * Loads every rule file found under a location such as {@code classpath:search-rules/}.
     */
    public SearchRuleRegistry load(String location) {
        String pattern = location.endsWith("/") ? location + "*.yml" : location + "/*.yml";
        log.info("Loading search rules from: {}", pattern);

        Resource[] ruleFiles;
        try {
            ruleFiles = resourceResolver.getResources(pattern);
        } catch (IOException e) {
            log.error("Failed to list search rule files at: {}", pattern, e);
            throw new IllegalStateException("Failed to load search rules from " + location, e);
        }
        Arrays.sort(ruleFiles, Comparator.comparing(r -> String.valueOf(r.getFilename())));

        SearchRuleRegistry.Builder builder = SearchRuleRegistry.builder();
        for (Resource ruleFile : ruleFiles) {
            loadRuleFile(ruleFile, builder);
        }

        SearchRuleRegistry registry = builder.build();
        log.info("Loaded {} search rules for {} resource types: {}",
                registry.ruleCount(), registry.types().size(), String.join(", ", registry.types()));
        return registry;
    }

    private void loadRuleFile(Resource ruleFile, SearchRuleRegistry.Builder builder) {
        String filename = ruleFile.getFilename();
        RuleFileDefinition definition;
        try (InputStream is = ruleFile.getInputStream()) {
            definition = yamlMapper.readValue(is, RuleFileDefinition.class);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable search rule file " + filename, e);
        }

        if (definition == null) {
            log.warn("Skipping empty search rule file {}", filename);
            return;
        }
        if (!definition.isCommon() && (definition.getResourceType() == null || definition.getResourceType().isBlank())) {
            log.warn("Skipping search rule file {} - missing resourceType", filename);
            return;
        }

        for (RuleDefinition ruleDefinition : definition.getParameters()) {
            SearchRule rule;
            try {
                rule = ruleDefinition.toRule();
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(String.format("Invalid search rule '%s' in %s: %s",
                        ruleDefinition.getName(), filename, e.getMessage()), e);
            }
            if (definition.isCommon()) {
                builder.common(rule);
            } else {
                builder.rule(definition.getResourceType(), rule);
            }
        }

        log.debug("Loaded {} rules from {} ({})", definition.getParameters().size(), filename,
                definition.isCommon() ? "common" : definition.getResourceType());
    }
}
