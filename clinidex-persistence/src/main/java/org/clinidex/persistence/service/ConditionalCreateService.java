package org.clinidex.persistence.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.clinidex.core.document.Document;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.search.SearchQueryParser;
import org.clinidex.core.search.SearchRequest;
import org.clinidex.core.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for conditional creates: a document is written only when no current document
 * of its type matches the given search criteria.
 * <p>
 * One match returns that document unchanged; more than one match is rejected with issue
 * {@code duplicate}. The lookup and the write share one transaction but take no lock on
 * the criteria, so two concurrent creators with the same criteria may both write.
 * </p>
 */
@Service
public class ConditionalCreateService {

    private static final Logger log = LoggerFactory.getLogger(ConditionalCreateService.class);

    private final DocumentStoreService storeService;
    private final DocumentSearchService searchService;
    private final SearchQueryParser queryParser;

    public ConditionalCreateService(DocumentStoreService storeService,
                                    DocumentSearchService searchService,
                                    SearchQueryParser queryParser) {
        this.storeService = storeService;
        this.searchService = searchService;
        this.queryParser = queryParser;
    }

    /**
     * Create a document under a generated id unless the criteria match an existing one.
     *
     * @param criteria a query string such as {@code identifier=urn:mrn|123}
     */
    @Transactional
    public ConditionalCreateResult createIfNoneExist(String type, JsonNode body, String criteria) {
        return createIfNoneExist(type, null, body, criteria);
    }

    /**
     * Create a document under {@code id} (generated when null) unless the criteria match
     * an existing one. An {@code id} field of the body is ignored.
     */
    @Transactional
    public ConditionalCreateResult createIfNoneExist(String type, String id, JsonNode body, String criteria) {
        Optional<Document> existing = findExisting(type, criteria);
        if (existing.isPresent()) {
            log.info("Conditional create of {} matched {}/{}, nothing written", type, type, existing.get().id());
            return new ConditionalCreateResult(existing.get(), false);
        }

        JsonNode toWrite = body;
        if (body != null && body.isObject()) {
            ObjectNode copy = body.deepCopy();
            copy.remove("id");
            toWrite = copy;
        }
        return new ConditionalCreateResult(storeService.write(type, id, toWrite, 0), true);
    }

    /**
     * The current document the criteria select, if any.
     *
     * @throws ClinidexException with issue {@code invalid} if the criteria hold no predicate,
     *                           or {@code duplicate} if they match more than one document
     */
    @Transactional(readOnly = true)
    public Optional<Document> findExisting(String type, String criteria) {
        String query = criteria != null && criteria.startsWith("?") ? criteria.substring(1) : criteria;
        SearchRequest request = queryParser.parseQueryString(type, query);
        if (request.getPredicates().isEmpty()) {
            throw new ClinidexException("Conditional create of " + type + " needs at least one search criterion",
                    "invalid", "Criteria: '" + criteria + "'");
        }

        SearchResult result = searchService.search(request.toBuilder()
                .limit(2)
                .offset(0)
                .sort(List.of())
                .includes(List.of())
                .revIncludes(List.of())
                .includeDeleted(false)
                .build());

        if (result.total() > 1) {
            throw new ClinidexException(String.format("Conditional create criteria '%s' match %d %s documents",
                    criteria, result.total(), type), "duplicate");
        }
        return result.matches().stream().findFirst();
    }
}
