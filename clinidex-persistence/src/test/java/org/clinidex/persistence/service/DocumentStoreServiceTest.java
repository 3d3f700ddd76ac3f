package org.clinidex.persistence.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.clinidex.core.document.Document;
import org.clinidex.core.document.HistoryOperation;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.exception.ExtractionFailureException;
import org.clinidex.core.exception.MalformedDocumentException;
import org.clinidex.core.exception.ResourceNotFoundException;
import org.clinidex.core.exception.VersionConflictException;
import org.clinidex.core.extract.ExtractionResult;
import org.clinidex.core.extract.ParameterExtractor;
import org.clinidex.core.reference.ReferenceNormalizer;
import org.clinidex.core.rules.ParameterKind;
import org.clinidex.core.rules.SearchRule;
import org.clinidex.core.rules.SearchRuleRegistry;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.DocumentHistoryEntity;
import org.clinidex.persistence.metrics.StoreMetrics;
import org.clinidex.persistence.repository.DocumentHistoryRepository;
import org.clinidex.persistence.repository.DocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link DocumentStoreService} write paths, with the repositories mocked.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentStoreService")
class DocumentStoreServiceTest {

    private static final String TYPE = "Patient";
    private static final String ID = "p1";

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private DocumentHistoryRepository historyRepository;

    @Mock
    private IndexTableService indexTableService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private DocumentStoreService service;

    @BeforeEach
    void setUp() {
        SearchRuleRegistry registry = SearchRuleRegistry.builder()
                .rule(TYPE, SearchRule.of("family", ParameterKind.STRING, "name.family"))
                .rule(TYPE, SearchRule.of("birthdate", ParameterKind.DATE, "birthDate"))
                .build();
        meterRegistry = new SimpleMeterRegistry();
        service = new DocumentStoreService(documentRepository, historyRepository, indexTableService,
                new ParameterExtractor(registry, new ReferenceNormalizer()),
                new DocumentMapper(), new StoreMetrics(meterRegistry));
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private static DocumentEntity stored(int version, boolean deleted) {
        return DocumentEntity.builder()
                .id(UUID.randomUUID())
                .resourceType(TYPE)
                .resourceId(ID)
                .versionId(version)
                .isDeleted(deleted)
                .content(deleted ? "{}" : "{\"name\":[{\"family\":\"Old\"}]}")
                .lastUpdated(Instant.parse("2024-01-01T00:00:00Z"))
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }

    private double counter(String name) {
        return meterRegistry.find(name).counters().stream().mapToDouble(c -> c.count()).sum();
    }

    @Nested
    @DisplayName("write")
    class Write {

        @Test
        @DisplayName("should create version 1 with a CREATE history entry and fresh index rows")
        void shouldCreateFirstVersion() throws Exception {
            UUID documentId = UUID.randomUUID();
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.empty());
            when(documentRepository.saveAndFlush(any(DocumentEntity.class))).thenAnswer(inv -> {
                DocumentEntity entity = inv.getArgument(0);
                entity.setId(documentId);
                return entity;
            });

            Document written = service.write(TYPE, ID, json("{\"name\": [{\"family\": \"Smith\"}]}"));

            assertEquals(1, written.version());
            assertFalse(written.deleted());
            assertEquals("Smith", written.body().at("/name/0/family").asText());

            ArgumentCaptor<DocumentHistoryEntity> history = ArgumentCaptor.forClass(DocumentHistoryEntity.class);
            verify(historyRepository).saveAndFlush(history.capture());
            assertEquals(HistoryOperation.CREATE, history.getValue().getOperation());
            assertEquals(1, history.getValue().getVersionId());
            assertEquals(documentId, history.getValue().getDocumentId());

            ArgumentCaptor<ExtractionResult> extraction = ArgumentCaptor.forClass(ExtractionResult.class);
            verify(indexTableService).replace(eq(documentId), eq(TYPE), eq(ID), extraction.capture());
            assertEquals("Smith", extraction.getValue().rows().get(0).text());
            assertEquals(1.0, counter("clinidex.writes"));
        }

        @Test
        @DisplayName("should advance an existing document to the next version")
        void shouldUpdateExistingDocument() throws Exception {
            DocumentEntity current = stored(3, false);
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.of(current));
            when(documentRepository.advanceVersion(eq(current.getId()), eq(3), eq(4), eq(false), anyString(), any()))
                    .thenReturn(1);

            Document written = service.write(TYPE, ID, json("{\"name\": [{\"family\": \"New\"}]}"), 3);

            assertEquals(4, written.version());
            ArgumentCaptor<DocumentHistoryEntity> history = ArgumentCaptor.forClass(DocumentHistoryEntity.class);
            verify(historyRepository).saveAndFlush(history.capture());
            assertEquals(HistoryOperation.UPDATE, history.getValue().getOperation());
            verify(documentRepository, never()).saveAndFlush(any(DocumentEntity.class));
        }

        @Test
        @DisplayName("should revive a tombstone as an update")
        void shouldReviveTombstone() throws Exception {
            DocumentEntity tombstone = stored(2, true);
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.of(tombstone));
            when(documentRepository.advanceVersion(eq(tombstone.getId()), eq(2), eq(3), eq(false), anyString(), any()))
                    .thenReturn(1);

            Document written = service.write(TYPE, ID, json("{\"active\": true}"));

            assertEquals(3, written.version());
            assertFalse(written.deleted());
        }

        @Test
        @DisplayName("should reject a stale expected version without touching the store")
        void shouldRejectStaleExpectedVersion() throws Exception {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.of(stored(3, false)));
            JsonNode body = json("{\"active\": true}");

            VersionConflictException e = assertThrows(VersionConflictException.class,
                    () -> service.write(TYPE, ID, body, 2));

            assertEquals(2, e.getExpectedVersion());
            assertEquals(3, e.getActualVersion());
            verify(documentRepository, never()).advanceVersion(any(), any(), any(), any(), any(), any());
            verifyNoInteractions(historyRepository, indexTableService);
            assertEquals(1.0, counter("clinidex.conflicts"));
        }

        @Test
        @DisplayName("should treat a non-zero expected version on an absent key as a conflict")
        void shouldRejectExpectedVersionOnAbsentKey() throws Exception {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.empty());
            JsonNode body = json("{\"active\": true}");

            assertThrows(VersionConflictException.class, () -> service.write(TYPE, ID, body, 1));
            verify(documentRepository, never()).saveAndFlush(any(DocumentEntity.class));
        }

        @Test
        @DisplayName("should report a lost compare-and-set as a conflict")
        void shouldRejectLostCompareAndSet() throws Exception {
            DocumentEntity current = stored(1, false);
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.of(current));
            when(documentRepository.advanceVersion(any(), any(), any(), any(), any(), any())).thenReturn(0);
            JsonNode body = json("{\"active\": true}");

            assertThrows(VersionConflictException.class, () -> service.write(TYPE, ID, body));
            verifyNoInteractions(historyRepository);
        }

        @Test
        @DisplayName("should map a duplicate-key insert to a conflict")
        void shouldMapConcurrentCreateToConflict() throws Exception {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.empty());
            when(documentRepository.saveAndFlush(any(DocumentEntity.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_clx_document_key"));
            JsonNode body = json("{\"active\": true}");

            VersionConflictException e = assertThrows(VersionConflictException.class,
                    () -> service.write(TYPE, ID, body, 0));
            assertEquals("conflict", e.getIssueCode());
        }

        @Test
        @DisplayName("should map a duplicate history version to a conflict")
        void shouldMapDuplicateHistoryVersionToConflict() throws Exception {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.empty());
            when(documentRepository.saveAndFlush(any(DocumentEntity.class))).thenAnswer(inv -> {
                DocumentEntity entity = inv.getArgument(0);
                entity.setId(UUID.randomUUID());
                return entity;
            });
            when(historyRepository.saveAndFlush(any(DocumentHistoryEntity.class)))
                    .thenThrow(new DataIntegrityViolationException("could not execute statement",
                            new RuntimeException("Unique index violation: \"PUBLIC.UK_CLX_HISTORY_VERSION_INDEX_4\"")));
            JsonNode body = json("{\"active\": true}");

            assertThrows(VersionConflictException.class, () -> service.write(TYPE, ID, body));
        }

        @Test
        @DisplayName("should not report other integrity violations as a conflict")
        void shouldKeepOtherIntegrityViolationsApartFromConflicts() throws Exception {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.empty());
            when(documentRepository.saveAndFlush(any(DocumentEntity.class)))
                    .thenThrow(new DataIntegrityViolationException("could not execute statement",
                            new RuntimeException("Value too long for column \"VALUE_STRING\"")));
            JsonNode body = json("{\"active\": true}");

            ClinidexException e = assertThrows(ClinidexException.class, () -> service.write(TYPE, ID, body));

            assertFalse(e instanceof VersionConflictException);
            assertEquals("processing", e.getIssueCode());
            assertTrue(e.getDiagnostics().contains("Value too long"));
            assertEquals(0.0, counter("clinidex.conflicts"));
        }

        @Test
        @DisplayName("should reject a body an extraction rule cannot read, before any row is written")
        void shouldRejectExtractionFailure() throws Exception {
            JsonNode body = json("{\"birthDate\": \"someday\"}");

            ExtractionFailureException e = assertThrows(ExtractionFailureException.class,
                    () -> service.write(TYPE, ID, body));

            assertEquals(ID, e.getResourceId());
            assertEquals("birthdate", e.getRuleName());
            verifyNoInteractions(documentRepository, historyRepository, indexTableService);
            assertEquals(1.0, counter("clinidex.extraction.failures"));
        }

        @Test
        void shouldRejectMalformedBody() throws Exception {
            JsonNode body = json("{\"resourceType\": \"Observation\"}");

            assertThrows(MalformedDocumentException.class, () -> service.write(TYPE, ID, body));
            verifyNoInteractions(documentRepository);
        }

        @Test
        void shouldGenerateIdWhenNoneGiven() throws Exception {
            when(documentRepository.findForUpdate(eq(TYPE), anyString())).thenReturn(Optional.empty());
            when(documentRepository.saveAndFlush(any(DocumentEntity.class))).thenAnswer(inv -> inv.getArgument(0));

            Document written = service.write(TYPE, null, json("{\"active\": true}"), null);

            assertNotNull(written.id());
            assertEquals(36, written.id().length());
        }
    }

    @Nested
    @DisplayName("softDelete")
    class SoftDelete {

        @Test
        @DisplayName("should write a tombstone version and clear the index")
        void shouldWriteTombstone() {
            DocumentEntity current = stored(2, false);
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.of(current));
            when(documentRepository.advanceVersion(eq(current.getId()), eq(2), eq(3), eq(true), eq("{}"), any()))
                    .thenReturn(1);

            Document tombstone = service.softDelete(TYPE, ID, null);

            assertTrue(tombstone.deleted());
            assertEquals(3, tombstone.version());
            assertEquals(0, tombstone.body().size());
            verify(indexTableService).clear(current.getId());
            ArgumentCaptor<DocumentHistoryEntity> history = ArgumentCaptor.forClass(DocumentHistoryEntity.class);
            verify(historyRepository).saveAndFlush(history.capture());
            assertEquals(HistoryOperation.DELETE, history.getValue().getOperation());
        }

        @Test
        void shouldRejectAbsentKey() {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class, () -> service.softDelete(TYPE, ID, null));
        }

        @Test
        void shouldRejectAlreadyDeleted() {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.of(stored(2, true)));

            assertThrows(ResourceNotFoundException.class, () -> service.softDelete(TYPE, ID, null));
        }

        @Test
        void shouldRejectStaleExpectedVersion() {
            when(documentRepository.findForUpdate(TYPE, ID)).thenReturn(Optional.of(stored(2, false)));

            assertThrows(VersionConflictException.class, () -> service.softDelete(TYPE, ID, 1));
            verifyNoInteractions(indexTableService);
        }
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        void shouldHideTombstoneUnlessAsked() {
            when(documentRepository.findByResourceTypeAndResourceId(TYPE, ID)).thenReturn(Optional.of(stored(2, true)));

            assertThrows(ResourceNotFoundException.class, () -> service.read(TYPE, ID));
            assertTrue(service.read(TYPE, ID, true).deleted());
        }

        @Test
        void shouldFailHistoryOfUnknownKey() {
            when(historyRepository.findByResourceTypeAndResourceIdOrderByVersionIdAsc(TYPE, ID)).thenReturn(List.of());

            assertThrows(ResourceNotFoundException.class, () -> service.history(TYPE, ID));
        }

        @Test
        void shouldFailMissingVersion() {
            when(historyRepository.findByResourceTypeAndResourceIdAndVersionId(TYPE, ID, 9)).thenReturn(Optional.empty());

            ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                    () -> service.readVersion(TYPE, ID, 9));
            assertEquals(9, e.getVersionId());
        }
    }
}
