package org.clinidex.persistence.bundle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.clinidex.core.document.Document;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.search.SearchQueryParser;
import org.clinidex.persistence.service.ConditionalCreateResult;
import org.clinidex.persistence.service.ConditionalCreateService;
import org.clinidex.persistence.service.DocumentSearchService;
import org.clinidex.persistence.service.DocumentStoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for processing batch and transaction bundles.
 * <p>
 * A bundle is a JSON object {@code {type, entry: [{fullUrl, resource, request: {method, url, ifMatch, ifNoneExist}}]}}.
 * Batch entries run independently, each in its own transaction, and failures are reported
 * per entry. Transaction entries run in one transaction and the first failure rolls back all
 * of them; {@code urn:uuid:} full URLs of created documents may be used as references by the
 * other entries and are rewritten to the assigned {@code Type/id}. A POST carrying
 * {@code ifNoneExist} criteria is a conditional create: when the criteria already match a
 * document, that document is returned and the entry's full URL points at it.
 * </p>
 */
@Service
public class BundleProcessorService {

    private static final Logger log = LoggerFactory.getLogger(BundleProcessorService.class);

    private static final String URN_UUID_PREFIX = "urn:uuid:";

    private final DocumentStoreService storeService;
    private final DocumentSearchService searchService;
    private final ConditionalCreateService conditionalCreateService;
    private final SearchQueryParser queryParser;
    private final TransactionTemplate transactionTemplate;

    public BundleProcessorService(DocumentStoreService storeService,
                                  DocumentSearchService searchService,
                                  ConditionalCreateService conditionalCreateService,
                                  SearchQueryParser queryParser,
                                  PlatformTransactionManager transactionManager) {
        this.storeService = storeService;
        this.searchService = searchService;
        this.conditionalCreateService = conditionalCreateService;
        this.queryParser = queryParser;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Process a bundle (batch or transaction).
     */
    public BundleResponse process(JsonNode bundle) {
        String type = bundle != null ? bundle.path("type").asText("") : "";
        return switch (type) {
            case "batch" -> processBatch(bundle);
            case "transaction" -> processTransaction(bundle);
            default -> throw new ClinidexException(
                    "Bundle type '" + type + "' is not supported. Only 'batch' and 'transaction' are allowed.",
                    "invalid");
        };
    }

    /**
     * Process a batch bundle: each entry independently, errors recorded per entry.
     */
    public BundleResponse processBatch(JsonNode bundle) {
        List<JsonNode> entries = entries(bundle);
        log.info("Processing batch bundle with {} entries", entries.size());

        List<BundleEntryResult> results = new ArrayList<>();
        for (JsonNode entry : entries) {
            try {
                results.add(processEntry(entry, Map.of()));
            } catch (ClinidexException e) {
                log.warn("Batch entry failed: {}", e.getMessage());
                results.add(BundleEntryResult.failed(resolveErrorStatus(e), e.getMessage()));
            }
        }
        return new BundleResponse("batch-response", results);
    }

    /**
     * Process a transaction bundle: all-or-nothing, rolled back on the first failure.
     */
    public BundleResponse processTransaction(JsonNode bundle) {
        List<JsonNode> entries = entries(bundle);
        log.info("Processing transaction bundle with {} entries", entries.size());

        List<BundleEntryResult> results = transactionTemplate.execute(status -> {
            Map<String, String> assigned = assignIds(entries);
            List<BundleEntryResult> processed = new ArrayList<>();
            for (JsonNode entry : entries) {
                processed.add(processEntry(entry, assigned));
            }
            return processed;
        });
        return new BundleResponse("transaction-response", results);
    }

    /**
     * Gives every POST entry with a {@code urn:uuid:} full URL its id up front, so other
     * entries can point at it. A conditional create that matches an existing document
     * takes that document's id.
     */
    private Map<String, String> assignIds(List<JsonNode> entries) {
        Map<String, String> assigned = new HashMap<>();
        for (JsonNode entry : entries) {
            String fullUrl = entry.path("fullUrl").asText("");
            if (fullUrl.startsWith(URN_UUID_PREFIX) && "POST".equals(method(entry))) {
                EntryUrl url = parseEntryUrl(entry.path("request").path("url").asText(null));
                String criteria = ifNoneExist(entry);
                String id = criteria == null ? UUID.randomUUID().toString()
                        : conditionalCreateService.findExisting(url.resourceType(), criteria)
                                .map(Document::id)
                                .orElseGet(() -> UUID.randomUUID().toString());
                assigned.put(fullUrl, url.resourceType() + "/" + id);
            }
        }
        return assigned;
    }

    private BundleEntryResult processEntry(JsonNode entry, Map<String, String> assigned) {
        JsonNode request = entry.get("request");
        if (request == null || !request.hasNonNull("method")) {
            throw new ClinidexException("Bundle entry is missing request or method", "required");
        }

        EntryUrl url = parseEntryUrl(request.path("url").asText(null));
        Integer ifMatch = parseIfMatch(request.path("ifMatch").asText(null));

        return switch (method(entry)) {
            case "GET" -> handleGet(url);
            case "POST" -> handlePost(entry, url, assigned);
            case "PUT" -> handlePut(entry, url, ifMatch, assigned);
            case "DELETE" -> handleDelete(url, ifMatch);
            default -> throw new ClinidexException("Unsupported method: " + method(entry), "not-supported");
        };
    }

    private BundleEntryResult handleGet(EntryUrl url) {
        if (url.resourceId() == null) {
            return BundleEntryResult.searched(
                    searchService.search(queryParser.parseQueryString(url.resourceType(), url.query())));
        }
        if (url.version() != null) {
            return BundleEntryResult.read(storeService.readVersion(url.resourceType(), url.resourceId(), url.version()));
        }
        return BundleEntryResult.read(storeService.read(url.resourceType(), url.resourceId()));
    }

    private BundleEntryResult handlePost(JsonNode entry, EntryUrl url, Map<String, String> assigned) {
        ObjectNode body = resource(entry, "POST", assigned);
        // The store assigns the id of a created document
        body.remove("id");

        String target = assigned.get(entry.path("fullUrl").asText(""));
        String id = target != null ? target.substring(target.indexOf('/') + 1) : null;

        String criteria = ifNoneExist(entry);
        if (criteria != null) {
            ConditionalCreateResult result =
                    conditionalCreateService.createIfNoneExist(url.resourceType(), id, body, criteria);
            return BundleEntryResult.written(result.created() ? "201 Created" : "200 OK", result.document());
        }
        Document written = storeService.write(url.resourceType(), id, body, 0);
        return BundleEntryResult.written("201 Created", written);
    }

    private BundleEntryResult handlePut(JsonNode entry, EntryUrl url, Integer ifMatch, Map<String, String> assigned) {
        if (url.resourceId() == null) {
            throw new ClinidexException("PUT entry URL must include resource ID", "required");
        }
        ObjectNode body = resource(entry, "PUT", assigned);
        Document written = storeService.write(url.resourceType(), url.resourceId(), body, ifMatch);
        return BundleEntryResult.written(written.version() == 1 ? "201 Created" : "200 OK", written);
    }

    private BundleEntryResult handleDelete(EntryUrl url, Integer ifMatch) {
        if (url.resourceId() == null) {
            throw new ClinidexException("DELETE entry URL must include resource ID", "required");
        }
        Document tombstone = storeService.softDelete(url.resourceType(), url.resourceId(), ifMatch);
        return new BundleEntryResult("204 No Content", null, tombstone.version(), null, null, null);
    }

    private ObjectNode resource(JsonNode entry, String method, Map<String, String> assigned) {
        JsonNode resource = entry.get("resource");
        if (resource == null || !resource.isObject()) {
            throw new ClinidexException(method + " entry is missing resource", "required");
        }
        ObjectNode copy = resource.deepCopy();
        if (!assigned.isEmpty()) {
            rewriteReferences(copy, assigned);
        }
        return copy;
    }

    /**
     * Replaces {@code reference} values that name a {@code urn:uuid:} entry of this bundle.
     */
    static void rewriteReferences(JsonNode node, Map<String, String> assigned) {
        if (node.isArray()) {
            node.forEach(element -> rewriteReferences(element, assigned));
            return;
        }
        if (!node.isObject()) {
            return;
        }
        ObjectNode object = (ObjectNode) node;
        JsonNode reference = object.get("reference");
        if (reference != null && reference.isTextual() && assigned.containsKey(reference.asText())) {
            object.set("reference", TextNode.valueOf(assigned.get(reference.asText())));
        }
        Iterator<JsonNode> children = object.elements();
        while (children.hasNext()) {
            JsonNode child = children.next();
            if (child.isContainerNode()) {
                rewriteReferences(child, assigned);
            }
        }
    }

    private static List<JsonNode> entries(JsonNode bundle) {
        List<JsonNode> entries = new ArrayList<>();
        bundle.path("entry").forEach(entries::add);
        return entries;
    }

    private static String ifNoneExist(JsonNode entry) {
        String criteria = entry.path("request").path("ifNoneExist").asText(null);
        return criteria == null || criteria.isBlank() ? null : criteria;
    }

    private static String method(JsonNode entry) {
        return entry.path("request").path("method").asText("").toUpperCase();
    }

    /**
     * Parse a bundle entry URL like {@code Patient/123}, {@code Patient/123/_history/2}
     * or {@code Patient?name=smith}.
     */
    static EntryUrl parseEntryUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ClinidexException("Bundle entry URL is required", "required");
        }

        String cleaned = url.startsWith("/") ? url.substring(1) : url;
        String query = null;
        int questionMark = cleaned.indexOf('?');
        if (questionMark >= 0) {
            query = cleaned.substring(questionMark + 1);
            cleaned = cleaned.substring(0, questionMark);
        }

        String[] parts = cleaned.split("/");
        if (parts.length == 0 || parts[0].isBlank()) {
            throw new ClinidexException("Invalid bundle entry URL: " + url, "invalid");
        }

        String resourceType = parts[0];
        String resourceId = parts.length > 1 ? parts[1] : null;
        Integer version = null;
        if (parts.length == 4 && "_history".equals(parts[2])) {
            version = parseVersion(parts[3], url);
        } else if (parts.length > 2) {
            throw new ClinidexException("Invalid bundle entry URL: " + url, "invalid");
        }
        return new EntryUrl(resourceType, resourceId, version, query);
    }

    /**
     * Accepts {@code 3}, {@code "3"} and the weak ETag form {@code W/"3"}.
     */
    static Integer parseIfMatch(String ifMatch) {
        if (ifMatch == null || ifMatch.isBlank()) {
            return null;
        }
        String cleaned = ifMatch.trim();
        if (cleaned.startsWith("W/")) {
            cleaned = cleaned.substring(2);
        }
        return parseVersion(cleaned.replace("\"", ""), ifMatch);
    }

    private static Integer parseVersion(String value, String source) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ClinidexException("Invalid version in '" + source + "'", "invalid");
        }
    }

    private static String resolveErrorStatus(ClinidexException e) {
        String issueCode = e.getIssueCode() != null ? e.getIssueCode() : "";
        return switch (issueCode) {
            case "not-found" -> "404 Not Found";
            case "conflict" -> "409 Conflict";
            case "duplicate" -> "412 Precondition Failed";
            case "exception" -> "422 Unprocessable Entity";
            default -> "400 Bad Request";
        };
    }

    record EntryUrl(String resourceType, String resourceId, Integer version, String query) {}
}
