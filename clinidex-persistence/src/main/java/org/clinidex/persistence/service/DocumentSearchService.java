package org.clinidex.persistence.service;

import org.clinidex.core.config.ClinidexProperties;
import org.clinidex.core.document.Document;
import org.clinidex.core.document.StructuralValidator;
import org.clinidex.core.exception.UnsupportedPredicateException;
import org.clinidex.core.rules.ParameterKind;
import org.clinidex.core.rules.SearchRule;
import org.clinidex.core.rules.SearchRuleRegistry;
import org.clinidex.core.search.IncludeSpec;
import org.clinidex.core.search.SearchQueryParser;
import org.clinidex.core.search.SearchRequest;
import org.clinidex.core.search.SearchResult;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.SearchIndexEntity;
import org.clinidex.persistence.metrics.StoreMetrics;
import org.clinidex.persistence.repository.DocumentRepository;
import org.clinidex.persistence.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Service for searching documents through the index tables.
 * <p>
 * Runs one query over the matches, then hydrates the page and resolves
 * {@code _include} and {@code _revinclude} directives through the stored reference rows.
 * </p>
 */
@Service
public class DocumentSearchService {

    private static final Logger log = LoggerFactory.getLogger(DocumentSearchService.class);

    private final DocumentRepository documentRepository;
    private final SearchIndexRepository searchIndexRepository;
    private final SearchRuleRegistry registry;
    private final SearchQueryParser queryParser;
    private final DocumentMapper mapper;
    private final ClinidexProperties properties;
    private final StoreMetrics metrics;

    public DocumentSearchService(DocumentRepository documentRepository,
                                 SearchIndexRepository searchIndexRepository,
                                 SearchRuleRegistry registry,
                                 SearchQueryParser queryParser,
                                 DocumentMapper mapper,
                                 ClinidexProperties properties,
                                 StoreMetrics metrics) {
        this.documentRepository = documentRepository;
        this.searchIndexRepository = searchIndexRepository;
        this.registry = registry;
        this.queryParser = queryParser;
        this.mapper = mapper;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Search with query-string style parameters, e.g. {@code name=smith&_sort=-birthdate}.
     */
    @Transactional(readOnly = true)
    public SearchResult search(String type, Map<String, List<String>> params) {
        return search(queryParser.parse(type, params));
    }

    /**
     * Search with a structured request.
     *
     * @throws UnsupportedPredicateException if a predicate, sort or include does not apply to the type
     */
    @Transactional(readOnly = true)
    public SearchResult search(SearchRequest request) {
        long started = System.nanoTime();
        StructuralValidator.validateType(request.getType());
        if (request.getOffset() < 0) {
            throw new UnsupportedPredicateException(request.getType(), "_offset", null, "Offset must not be negative");
        }

        int pageSize = properties.getSearch().effectivePageSize(request.getLimit());
        Page<DocumentEntity> page = documentRepository.search(request, pageSize);
        List<DocumentEntity> matches = page.getContent();

        Map<UUID, DocumentEntity> included = new LinkedHashMap<>();
        if (!matches.isEmpty()) {
            Set<UUID> matchIds = new HashSet<>();
            matches.forEach(entity -> matchIds.add(entity.getId()));
            for (IncludeSpec include : request.getIncludes()) {
                resolveInclude(request.getType(), include, matches, matchIds, included);
            }
            for (IncludeSpec revInclude : request.getRevIncludes()) {
                resolveRevInclude(revInclude, matches, matchIds, included);
            }
        }

        SearchResult result = new SearchResult(
                matches.stream().map(mapper::toDocument).toList(),
                included.values().stream().map(mapper::toDocument).toList(),
                page.getTotalElements());

        metrics.recordSearch(request.getType(), System.nanoTime() - started);
        log.debug("Search on {} matched {} (page of {}, {} included)",
                request.getType(), result.total(), result.matches().size(), result.included().size());
        return result;
    }

    /**
     * Documents the matches point at through the include's reference parameter.
     */
    private void resolveInclude(String type, IncludeSpec include, List<DocumentEntity> matches,
                                Set<UUID> matchIds, Map<UUID, DocumentEntity> included) {
        if (!include.sourceType().equals(type)) {
            log.debug("Skipping _include {}:{} on a search over {}", include.sourceType(), include.parameter(), type);
            return;
        }
        SearchRule rule = referenceRule(include, "_include");

        List<SearchIndexEntity> rows = searchIndexRepository.findByDocumentIdInAndParamNameAndParamKind(
                matchIds, rule.name(), ParameterKind.REFERENCE);

        Map<String, Set<String>> typedIds = new LinkedHashMap<>();
        Set<String> untypedIds = new HashSet<>();
        for (SearchIndexEntity row : rows) {
            String targetType = row.getValueReferenceType();
            if (targetType == null) {
                untypedIds.add(row.getValueReferenceId());
            } else if (include.targetType() == null || include.targetType().equals(targetType)) {
                typedIds.computeIfAbsent(targetType, k -> new HashSet<>()).add(row.getValueReferenceId());
            }
        }

        List<DocumentEntity> targets = new ArrayList<>();
        typedIds.forEach((targetType, ids) ->
                targets.addAll(documentRepository.findByResourceTypeAndResourceIdInAndIsDeletedFalse(targetType, ids)));
        if (!untypedIds.isEmpty()) {
            for (DocumentEntity candidate : documentRepository.findByResourceIdInAndIsDeletedFalse(untypedIds)) {
                if (include.targetType() == null || include.targetType().equals(candidate.getResourceType())) {
                    targets.add(candidate);
                }
            }
        }
        addIncluded(targets, matchIds, included);
    }

    /**
     * Documents of the directive's source type whose reference parameter points at a match.
     */
    private void resolveRevInclude(IncludeSpec revInclude, List<DocumentEntity> matches,
                                   Set<UUID> matchIds, Map<UUID, DocumentEntity> included) {
        SearchRule rule = referenceRule(revInclude, "_revinclude");

        Map<String, Set<String>> matchTypesById = new LinkedHashMap<>();
        for (DocumentEntity match : matches) {
            matchTypesById.computeIfAbsent(match.getResourceId(), k -> new HashSet<>()).add(match.getResourceType());
        }

        Set<UUID> sources = new HashSet<>();
        for (SearchIndexEntity row : searchIndexRepository.findByResourceTypeAndParamNameAndValueReferenceIdIn(
                revInclude.sourceType(), rule.name(), matchTypesById.keySet())) {
            String targetType = row.getValueReferenceType();
            Set<String> matchTypes = matchTypesById.get(row.getValueReferenceId());
            if (row.getComponent() == null && (targetType == null || matchTypes.contains(targetType))) {
                sources.add(row.getDocumentId());
            }
        }
        if (sources.isEmpty()) {
            return;
        }

        List<DocumentEntity> found = new ArrayList<>();
        for (DocumentEntity candidate : documentRepository.findAllById(sources)) {
            if (!Boolean.TRUE.equals(candidate.getIsDeleted())) {
                found.add(candidate);
            }
        }
        found.sort((a, b) -> a.getResourceId().compareTo(b.getResourceId()));
        addIncluded(found, matchIds, included);
    }

    private SearchRule referenceRule(IncludeSpec spec, String directive) {
        return registry.find(spec.sourceType(), spec.parameter())
                .filter(rule -> rule.kind() == ParameterKind.REFERENCE)
                .orElseThrow(() -> new UnsupportedPredicateException(spec.sourceType(), directive, null,
                        String.format("'%s' is not a reference parameter of %s", spec.parameter(), spec.sourceType())));
    }

    private static void addIncluded(List<DocumentEntity> candidates, Set<UUID> matchIds,
                                    Map<UUID, DocumentEntity> included) {
        for (DocumentEntity candidate : candidates) {
            if (!matchIds.contains(candidate.getId())) {
                included.putIfAbsent(candidate.getId(), candidate);
            }
        }
    }
}
