package org.clinidex.persistence.bundle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.clinidex.core.document.Document;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.exception.ResourceNotFoundException;
import org.clinidex.core.exception.VersionConflictException;
import org.clinidex.core.search.SearchQueryParser;
import org.clinidex.persistence.service.ConditionalCreateResult;
import org.clinidex.persistence.service.ConditionalCreateService;
import org.clinidex.persistence.service.DocumentSearchService;
import org.clinidex.persistence.service.DocumentStoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BundleProcessorService")
class BundleProcessorServiceTest {

    @Mock
    private DocumentStoreService storeService;

    @Mock
    private DocumentSearchService searchService;

    @Mock
    private ConditionalCreateService conditionalCreateService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private BundleProcessorService processor;

    @BeforeEach
    void setUp() {
        processor = new BundleProcessorService(storeService, searchService, conditionalCreateService,
                new SearchQueryParser(), transactionManager);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private static Document document(String type, String id, int version, JsonNode body) {
        return new Document(type, id, version, Instant.now(), false, (ObjectNode) body);
    }

    @Nested
    @DisplayName("Entry URLs")
    class EntryUrls {

        @Test
        void parseEntryUrl_TypeOnly() {
            BundleProcessorService.EntryUrl url = BundleProcessorService.parseEntryUrl("Patient");

            assertEquals("Patient", url.resourceType());
            assertNull(url.resourceId());
        }

        @Test
        void parseEntryUrl_TypeAndId_LeadingSlash() {
            BundleProcessorService.EntryUrl url = BundleProcessorService.parseEntryUrl("/Patient/p1");

            assertEquals("p1", url.resourceId());
            assertNull(url.version());
        }

        @Test
        void parseEntryUrl_HistoryVersion() {
            assertEquals(2, BundleProcessorService.parseEntryUrl("Patient/p1/_history/2").version());
        }

        @Test
        void parseEntryUrl_Query() {
            BundleProcessorService.EntryUrl url = BundleProcessorService.parseEntryUrl("Patient?name=smith&_count=2");

            assertNull(url.resourceId());
            assertEquals("name=smith&_count=2", url.query());
        }

        @Test
        void parseEntryUrl_Invalid_Throws() {
            assertThrows(ClinidexException.class, () -> BundleProcessorService.parseEntryUrl(""));
            assertThrows(ClinidexException.class, () -> BundleProcessorService.parseEntryUrl("Patient/p1/extra"));
            assertThrows(ClinidexException.class, () -> BundleProcessorService.parseEntryUrl("Patient/p1/_history/x"));
        }

        @Test
        void parseIfMatch_Forms() {
            assertNull(BundleProcessorService.parseIfMatch(null));
            assertEquals(3, BundleProcessorService.parseIfMatch("3"));
            assertEquals(3, BundleProcessorService.parseIfMatch("W/\"3\""));
        }

        @Test
        void rewriteReferences_ReplacesNestedPlaceholders() throws Exception {
            JsonNode body = json("""
                    {"subject": {"reference": "urn:uuid:a"},
                     "performer": [{"reference": "urn:uuid:b"}, {"reference": "Practitioner/x"}]}
                    """);

            BundleProcessorService.rewriteReferences(body, Map.of("urn:uuid:a", "Patient/1", "urn:uuid:b", "Practitioner/2"));

            assertEquals("Patient/1", body.at("/subject/reference").asText());
            assertEquals("Practitioner/2", body.at("/performer/0/reference").asText());
            assertEquals("Practitioner/x", body.at("/performer/1/reference").asText());
        }
    }

    @Nested
    @DisplayName("Batch")
    class Batch {

        @Test
        @DisplayName("should report per-entry failures and keep processing")
        void shouldIsolateEntryFailures() throws Exception {
            when(storeService.read("Patient", "missing")).thenThrow(new ResourceNotFoundException("Patient", "missing"));
            when(storeService.write(eq("Patient"), eq("p1"), any(), isNull()))
                    .thenAnswer(inv -> document("Patient", "p1", 2, inv.getArgument(2)));
            when(storeService.softDelete("Patient", "p2", 4))
                    .thenThrow(new VersionConflictException("Patient", "p2", 4, 5));

            BundleResponse response = processor.process(json("""
                    {"type": "batch", "entry": [
                      {"request": {"method": "GET", "url": "Patient/missing"}},
                      {"resource": {"resourceType": "Patient", "id": "p1"},
                       "request": {"method": "PUT", "url": "Patient/p1"}},
                      {"request": {"method": "DELETE", "url": "Patient/p2", "ifMatch": "W/\\"4\\""}},
                      {"request": {"url": "Patient/p3"}}
                    ]}
                    """));

            assertEquals("batch-response", response.type());
            assertEquals(4, response.entries().size());
            assertEquals("404 Not Found", response.entries().get(0).status());
            assertEquals("200 OK", response.entries().get(1).status());
            assertEquals("409 Conflict", response.entries().get(2).status());
            assertEquals("400 Bad Request", response.entries().get(3).status());
            assertFalse(response.entries().get(0).isSuccess());
            assertTrue(response.entries().get(1).isSuccess());
            verifyNoInteractions(transactionManager);
        }

        @Test
        @DisplayName("should answer a conditional create with the document it matched or wrote")
        void shouldHonourIfNoneExist() throws Exception {
            when(conditionalCreateService.createIfNoneExist(eq("Patient"), isNull(), any(), eq("identifier=urn:mrn|1")))
                    .thenAnswer(inv -> new ConditionalCreateResult(
                            document("Patient", "existing", 3, json("{\"resourceType\": \"Patient\"}")), false));
            when(conditionalCreateService.createIfNoneExist(eq("Patient"), isNull(), any(), eq("identifier=urn:mrn|2")))
                    .thenAnswer(inv -> new ConditionalCreateResult(
                            document("Patient", "fresh", 1, inv.getArgument(2)), true));
            when(conditionalCreateService.createIfNoneExist(eq("Patient"), isNull(), any(), eq("gender=female")))
                    .thenThrow(new ClinidexException("criteria match 2 Patient documents", "duplicate"));

            BundleResponse response = processor.process(json("""
                    {"type": "batch", "entry": [
                      {"resource": {"resourceType": "Patient"},
                       "request": {"method": "POST", "url": "Patient", "ifNoneExist": "identifier=urn:mrn|1"}},
                      {"resource": {"resourceType": "Patient"},
                       "request": {"method": "POST", "url": "Patient", "ifNoneExist": "identifier=urn:mrn|2"}},
                      {"resource": {"resourceType": "Patient"},
                       "request": {"method": "POST", "url": "Patient", "ifNoneExist": "gender=female"}}
                    ]}
                    """));

            assertEquals("200 OK", response.entries().get(0).status());
            assertEquals("Patient/existing/_history/3", response.entries().get(0).location());
            assertEquals("201 Created", response.entries().get(1).status());
            assertEquals("412 Precondition Failed", response.entries().get(2).status());
            verify(storeService, never()).write(anyString(), any(), any(), any());
        }

        @Test
        void shouldRejectUnknownBundleType() throws Exception {
            JsonNode bundle = json("{\"type\": \"collection\", \"entry\": []}");

            ClinidexException e = assertThrows(ClinidexException.class, () -> processor.process(bundle));
            assertEquals("invalid", e.getIssueCode());
        }
    }

    @Nested
    @DisplayName("Transaction")
    class Transaction {

        @Test
        @DisplayName("should assign ids up front and point references at them")
        void shouldRewriteUrnReferences() throws Exception {
            when(storeService.write(anyString(), anyString(), any(), eq(0)))
                    .thenAnswer(inv -> document(inv.getArgument(0), inv.getArgument(1), 1, inv.getArgument(2)));

            BundleResponse response = processor.process(json("""
                    {"type": "transaction", "entry": [
                      {"fullUrl": "urn:uuid:obs", "resource": {"resourceType": "Observation",
                         "subject": {"reference": "urn:uuid:pat"}},
                       "request": {"method": "POST", "url": "Observation"}},
                      {"fullUrl": "urn:uuid:pat", "resource": {"resourceType": "Patient", "id": "ignored"},
                       "request": {"method": "POST", "url": "Patient"}}
                    ]}
                    """));

            ArgumentCaptor<JsonNode> observation = ArgumentCaptor.forClass(JsonNode.class);
            ArgumentCaptor<String> patientId = ArgumentCaptor.forClass(String.class);
            verify(storeService).write(eq("Observation"), anyString(), observation.capture(), eq(0));
            verify(storeService).write(eq("Patient"), patientId.capture(), any(), eq(0));

            assertEquals("Patient/" + patientId.getValue(), observation.getValue().at("/subject/reference").asText());
            assertNotEquals("ignored", patientId.getValue());
            assertEquals("transaction-response", response.type());
            assertTrue(response.entries().stream().allMatch(entry -> entry.status().equals("201 Created")));
        }

        @Test
        @DisplayName("should point placeholders at the document a conditional create matched")
        void shouldLinkPlaceholderToExistingMatch() throws Exception {
            when(conditionalCreateService.findExisting("Patient", "identifier=urn:mrn|1"))
                    .thenReturn(Optional.of(document("Patient", "existing", 2, json("{}"))));
            when(conditionalCreateService.createIfNoneExist(eq("Patient"), eq("existing"), any(), eq("identifier=urn:mrn|1")))
                    .thenAnswer(inv -> new ConditionalCreateResult(document("Patient", "existing", 2, json("{}")), false));
            when(storeService.write(eq("Observation"), anyString(), any(), eq(0)))
                    .thenAnswer(inv -> document("Observation", inv.getArgument(1), 1, inv.getArgument(2)));

            BundleResponse response = processor.process(json("""
                    {"type": "transaction", "entry": [
                      {"fullUrl": "urn:uuid:pat", "resource": {"resourceType": "Patient"},
                       "request": {"method": "POST", "url": "Patient", "ifNoneExist": "identifier=urn:mrn|1"}},
                      {"fullUrl": "urn:uuid:obs", "resource": {"resourceType": "Observation",
                         "subject": {"reference": "urn:uuid:pat"}},
                       "request": {"method": "POST", "url": "Observation"}}
                    ]}
                    """));

            ArgumentCaptor<JsonNode> observation = ArgumentCaptor.forClass(JsonNode.class);
            verify(storeService).write(eq("Observation"), anyString(), observation.capture(), eq(0));
            assertEquals("Patient/existing", observation.getValue().at("/subject/reference").asText());
            assertEquals("200 OK", response.entries().get(0).status());
            assertEquals("201 Created", response.entries().get(1).status());
        }

        @Test
        @DisplayName("should propagate the first failure so the whole bundle rolls back")
        void shouldFailAsAWhole() throws Exception {
            when(storeService.write(eq("Patient"), eq("p1"), any(), isNull()))
                    .thenAnswer(inv -> document("Patient", "p1", 1, inv.getArgument(2)));
            when(storeService.read("Patient", "gone")).thenThrow(new ResourceNotFoundException("Patient", "gone"));
            JsonNode bundle = json("""
                    {"type": "transaction", "entry": [
                      {"resource": {"resourceType": "Patient"}, "request": {"method": "PUT", "url": "Patient/p1"}},
                      {"request": {"method": "GET", "url": "Patient/gone"}}
                    ]}
                    """);

            assertThrows(ResourceNotFoundException.class, () -> processor.process(bundle));
            verify(transactionManager).rollback(any());
        }
    }
}
