package org.clinidex.persistence.service;

import org.clinidex.core.reference.CanonicalRef;
import org.clinidex.core.reference.UntypedReferenceResolver;
import org.clinidex.core.rules.ParameterKind;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.SearchIndexEntity;
import org.clinidex.persistence.repository.DocumentRepository;
import org.clinidex.persistence.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Resolves an untyped reference token to the one live document it names.
 * <p>
 * A document is a candidate when its id equals the token or when one of its
 * {@code identifier} token rows carries the token as code. More than one distinct
 * candidate leaves the reference untyped.
 * </p>
 */
@Component
public class StoreReferenceResolver implements UntypedReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(StoreReferenceResolver.class);

    static final String IDENTIFIER_PARAM = "identifier";

    private final DocumentRepository documentRepository;
    private final SearchIndexRepository searchIndexRepository;

    public StoreReferenceResolver(DocumentRepository documentRepository,
                                  SearchIndexRepository searchIndexRepository) {
        this.documentRepository = documentRepository;
        this.searchIndexRepository = searchIndexRepository;
    }

    @Override
    public Optional<CanonicalRef.Typed> resolve(String token) {
        Set<CanonicalRef.Typed> candidates = new LinkedHashSet<>();

        for (DocumentEntity document : documentRepository.findByResourceIdAndIsDeletedFalse(token)) {
            candidates.add(new CanonicalRef.Typed(document.getResourceType(), document.getResourceId()));
        }

        Set<UUID> identified = searchIndexRepository
                .findByParamNameAndParamKindAndValueTokenCode(IDENTIFIER_PARAM, ParameterKind.TOKEN, token)
                .stream()
                .map(SearchIndexEntity::getDocumentId)
                .collect(Collectors.toSet());
        if (!identified.isEmpty()) {
            for (DocumentEntity document : documentRepository.findAllById(identified)) {
                if (!Boolean.TRUE.equals(document.getIsDeleted())) {
                    candidates.add(new CanonicalRef.Typed(document.getResourceType(), document.getResourceId()));
                }
            }
        }

        if (candidates.size() == 1) {
            CanonicalRef.Typed resolved = candidates.iterator().next();
            log.debug("Resolved untyped reference '{}' to {}", token, resolved);
            return Optional.of(resolved);
        }
        if (candidates.size() > 1) {
            log.debug("Untyped reference '{}' is ambiguous across {} documents", token, candidates.size());
        }
        return Optional.empty();
    }
}
