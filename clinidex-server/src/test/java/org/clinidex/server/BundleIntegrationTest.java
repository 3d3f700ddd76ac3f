package org.clinidex.server;

import com.fasterxml.jackson.databind.JsonNode;
import org.clinidex.core.document.Document;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.exception.ResourceNotFoundException;
import org.clinidex.core.search.SearchQueryParser;
import org.clinidex.core.search.SearchResult;
import org.clinidex.persistence.bulk.BulkDocument;
import org.clinidex.persistence.bulk.BulkFailure;
import org.clinidex.persistence.bulk.BulkImportResult;
import org.clinidex.persistence.bulk.BulkImportService;
import org.clinidex.persistence.bundle.BundleEntryResult;
import org.clinidex.persistence.bundle.BundleProcessorService;
import org.clinidex.persistence.bundle.BundleResponse;
import org.clinidex.persistence.health.RuleRegistryHealthIndicator;
import org.clinidex.persistence.service.ConditionalCreateResult;
import org.clinidex.persistence.service.ConditionalCreateService;
import org.clinidex.persistence.service.DocumentSearchService;
import org.clinidex.persistence.service.DocumentStoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;

import static org.clinidex.server.support.StoreTestSupport.clearStore;
import static org.clinidex.server.support.StoreTestSupport.json;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = ClinidexApplication.class)
@ActiveProfiles("test")
class BundleIntegrationTest {

    @Autowired
    private BundleProcessorService bundleProcessor;

    @Autowired
    private BulkImportService bulkImportService;

    @Autowired
    private DocumentStoreService storeService;

    @Autowired
    private DocumentSearchService searchService;

    @Autowired
    private ConditionalCreateService conditionalCreateService;

    @Autowired
    private SearchQueryParser queryParser;

    @Autowired
    private RuleRegistryHealthIndicator healthIndicator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        clearStore(jdbcTemplate);
    }

    private SearchResult search(String type, String query) {
        return searchService.search(queryParser.parseQueryString(type, query));
    }

    @Nested
    @DisplayName("Transaction bundles")
    class Transactions {

        @Test
        @DisplayName("Entries created together should be able to point at each other")
        void transaction_LinksPlaceholderReferences() {
            BundleResponse response = bundleProcessor.process(json("""
                    {"type": "transaction", "entry": [
                      {"fullUrl": "urn:uuid:pat", "resource": {"resourceType": "Patient",
                         "name": [{"family": "Bundled"}]},
                       "request": {"method": "POST", "url": "Patient"}},
                      {"fullUrl": "urn:uuid:obs", "resource": {"resourceType": "Observation",
                         "status": "final", "subject": {"reference": "urn:uuid:pat"}},
                       "request": {"method": "POST", "url": "Observation"}}
                    ]}
                    """));

            assertEquals("transaction-response", response.type());
            assertEquals(2, response.entries().size());
            Document patient = response.entries().get(0).document();
            Document observation = response.entries().get(1).document();
            assertEquals("Patient/" + patient.id(), observation.body().at("/subject/reference").asText());
            assertEquals(List.of(observation.id()), search("Observation", "patient.family=bundled").matchIds());
        }

        @Test
        @DisplayName("A failing entry should undo every write of the bundle")
        void transaction_FailureRollsBackEarlierEntries() {
            JsonNode bundle = json("""
                    {"type": "transaction", "entry": [
                      {"resource": {"resourceType": "Patient", "name": [{"family": "Ghost"}]},
                       "request": {"method": "PUT", "url": "Patient/t1"}},
                      {"request": {"method": "GET", "url": "Patient/missing"}}
                    ]}
                    """);

            assertThrows(ResourceNotFoundException.class, () -> bundleProcessor.process(bundle));

            assertThrows(ResourceNotFoundException.class, () -> storeService.read("Patient", "t1"));
            assertEquals(0, search("Patient", "family=ghost").total());
        }
    }

    @Nested
    @DisplayName("Batch bundles")
    class Batches {

        @Test
        void batch_EntriesSucceedOrFailIndependently() {
            storeService.write("Patient", "b1", json("{\"resourceType\": \"Patient\"}"));

            BundleResponse response = bundleProcessor.process(json("""
                    {"type": "batch", "entry": [
                      {"resource": {"resourceType": "Patient", "name": [{"family": "Kept"}]},
                       "request": {"method": "PUT", "url": "Patient/b2"}},
                      {"resource": {"resourceType": "Patient"},
                       "request": {"method": "PUT", "url": "Patient/b1", "ifMatch": "W/\\"7\\""}},
                      {"request": {"method": "DELETE", "url": "Patient/b1"}},
                      {"request": {"method": "GET", "url": "Patient?family=kept"}}
                    ]}
                    """));

            List<String> statuses = response.entries().stream().map(BundleEntryResult::status).toList();
            assertEquals(List.of("201 Created", "409 Conflict", "204 No Content", "200 OK"), statuses);
            assertEquals(List.of("b2"), response.entries().get(3).searchResult().matchIds());
            assertEquals("Patient/b2/_history/1", response.entries().get(0).location());
            assertTrue(storeService.read("Patient", "b1", true).deleted());
        }
    }

    @Nested
    @DisplayName("Conditional create")
    class ConditionalCreate {

        private final JsonNode patient = json("""
                {"resourceType": "Patient", "identifier": [{"system": "urn:mrn", "value": "MRN-9"}],
                 "name": [{"family": "Once"}]}
                """);

        @Test
        @DisplayName("Should write when nothing matches and return the match afterwards")
        void createIfNoneExist_WritesOnce() {
            ConditionalCreateResult first = conditionalCreateService.createIfNoneExist("Patient", patient,
                    "identifier=urn:mrn|MRN-9");
            ConditionalCreateResult second = conditionalCreateService.createIfNoneExist("Patient", patient,
                    "identifier=urn:mrn|MRN-9");

            assertTrue(first.created());
            assertFalse(second.created());
            assertEquals(first.document().id(), second.document().id());
            assertEquals(1, second.document().version());
            assertEquals(1, search("Patient", "family=once").total());
        }

        @Test
        void createIfNoneExist_SeveralMatches_Rejected() {
            storeService.write("Patient", "a", json("{\"resourceType\": \"Patient\", \"gender\": \"female\"}"));
            storeService.write("Patient", "b", json("{\"resourceType\": \"Patient\", \"gender\": \"female\"}"));

            ClinidexException e = assertThrows(ClinidexException.class,
                    () -> conditionalCreateService.createIfNoneExist("Patient", patient, "gender=female"));

            assertEquals("duplicate", e.getIssueCode());
            assertEquals(2, search("Patient", "").total());
        }

        @Test
        void createIfNoneExist_NoCriteria_Rejected() {
            ClinidexException e = assertThrows(ClinidexException.class,
                    () -> conditionalCreateService.createIfNoneExist("Patient", patient, "_count=5"));

            assertEquals("invalid", e.getIssueCode());
        }

        @Test
        @DisplayName("A transaction should reuse the matched document for its placeholder")
        void transaction_IfNoneExist_LinksToExistingDocument() {
            Document existing = storeService.write("Patient", "known", patient);

            BundleResponse response = bundleProcessor.process(json("""
                    {"type": "transaction", "entry": [
                      {"fullUrl": "urn:uuid:pat", "resource": {"resourceType": "Patient", "name": [{"family": "Other"}]},
                       "request": {"method": "POST", "url": "Patient", "ifNoneExist": "identifier=urn:mrn|MRN-9"}},
                      {"resource": {"resourceType": "Observation", "status": "final",
                         "subject": {"reference": "urn:uuid:pat"}},
                       "request": {"method": "POST", "url": "Observation"}}
                    ]}
                    """));

            assertEquals("200 OK", response.entries().get(0).status());
            assertEquals(existing.id(), response.entries().get(0).document().id());
            assertEquals("Patient/known", response.entries().get(1).document().body().at("/subject/reference").asText());
            assertEquals(List.of("known"), search("Patient", "").matchIds());
            assertEquals(1, search("Observation", "patient.family=once").total());
        }
    }

    @Nested
    @DisplayName("Bulk import")
    class BulkImport {

        @Test
        void importAll_WritesEveryDocumentAndIndexesIt() {
            List<BulkDocument> documents = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                documents.add(BulkDocument.of("Patient", "bulk-" + i, json("""
                        {"resourceType": "Patient", "gender": "%s", "name": [{"family": "Bulk%d"}]}
                        """.formatted(i % 2 == 0 ? "female" : "male", i))));
            }

            BulkImportResult result = bulkImportService.importAll(documents);

            assertEquals(40, result.succeeded());
            assertFalse(result.hasFailures());
            assertEquals("bulk-7", result.written().get(7).id());
            assertEquals(40, search("Patient", "family=bulk").total());
            assertEquals(20, search("Patient", "gender=female").total());
        }

        @Test
        void importAll_ReportsRejectedDocuments() {
            BulkImportResult result = bulkImportService.importAll(List.of(
                    BulkDocument.of("Patient", "ok", json("{\"resourceType\": \"Patient\"}")),
                    BulkDocument.of("Patient", "wrong-type", json("{\"resourceType\": \"Observation\"}")),
                    BulkDocument.of("Patient", "bad-date", json("{\"resourceType\": \"Patient\", \"birthDate\": \"soon\"}"))));

            assertEquals(1, result.succeeded());
            assertEquals(List.of("structure", "exception"),
                    result.failures().stream().map(BulkFailure::issueCode).toList());
            assertEquals(List.of("ok"), search("Patient", "").matchIds());
        }
    }

    @Test
    void health_ReportsLoadedRules() {
        assertEquals(Status.UP, healthIndicator.health().getStatus());
        assertEquals(6, healthIndicator.health().getDetails().get("types"));
    }
}
