package org.clinidex.core.config;

import org.clinidex.core.extract.ParameterExtractor;
import org.clinidex.core.reference.ReferenceNormalizer;
import org.clinidex.core.reference.UntypedReferenceResolver;
import org.clinidex.core.rules.SearchRuleLoader;
import org.clinidex.core.rules.SearchRuleRegistry;
import org.clinidex.core.search.SearchQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the rule registry and the extraction pipeline.
 * <p>
 * The registry is built once at startup and handed to the extractor; nothing else
 * holds or mutates rule state.
 * </p>
 */
@Configuration
@EnableConfigurationProperties(ClinidexProperties.class)
public class CoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CoreConfiguration.class);

    @Bean
    public SearchRuleRegistry searchRuleRegistry(ClinidexProperties properties) {
        return new SearchRuleLoader().load(properties.getRules().getLocation());
    }

    @Bean
    public ReferenceNormalizer referenceNormalizer() {
        return new ReferenceNormalizer();
    }

    @Bean
    public ParameterExtractor parameterExtractor(SearchRuleRegistry registry,
                                                 ReferenceNormalizer normalizer,
                                                 ObjectProvider<UntypedReferenceResolver> resolvers,
                                                 ClinidexProperties properties) {
        UntypedReferenceResolver resolver = UntypedReferenceResolver.NONE;
        if (properties.getReferences().isResolveUntyped()) {
            resolver = resolvers.getIfAvailable(() -> UntypedReferenceResolver.NONE);
        }
        log.info("Untyped reference resolution {}", resolver == UntypedReferenceResolver.NONE ? "disabled" : "enabled");
        return new ParameterExtractor(registry, normalizer, resolver);
    }

    @Bean
    public SearchQueryParser searchQueryParser() {
        return new SearchQueryParser();
    }
}
