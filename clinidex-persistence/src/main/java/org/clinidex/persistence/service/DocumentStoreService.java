package org.clinidex.persistence.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.clinidex.core.document.Document;
import org.clinidex.core.document.HistoryEntry;
import org.clinidex.core.document.HistoryOperation;
import org.clinidex.core.document.StructuralValidator;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.exception.ExtractionFailureException;
import org.clinidex.core.exception.ResourceNotFoundException;
import org.clinidex.core.exception.VersionConflictException;
import org.clinidex.core.extract.ExtractionResult;
import org.clinidex.core.extract.ParameterExtractor;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.DocumentHistoryEntity;
import org.clinidex.persistence.metrics.StoreMetrics;
import org.clinidex.persistence.repository.DocumentHistoryRepository;
import org.clinidex.persistence.repository.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for versioned document writes, reads and history.
 * <p>
 * A write stores the new current row, appends one history entry and regenerates the
 * document's index rows and reference edges in a single transaction, so a committed
 * document is always searchable exactly as written. Writers of one key serialize on
 * the row lock of its current version; writers of different keys never meet.
 * </p>
 */
@Service
public class DocumentStoreService {

    private static final Logger log = LoggerFactory.getLogger(DocumentStoreService.class);

    private static final String TOMBSTONE_CONTENT = "{}";

    private static final List<String> KEY_CONSTRAINTS = List.of("uk_clx_document_key", "uk_clx_history_version");

    private final DocumentRepository documentRepository;
    private final DocumentHistoryRepository historyRepository;
    private final IndexTableService indexTableService;
    private final ParameterExtractor extractor;
    private final DocumentMapper mapper;
    private final StoreMetrics metrics;

    public DocumentStoreService(DocumentRepository documentRepository,
                                DocumentHistoryRepository historyRepository,
                                IndexTableService indexTableService,
                                ParameterExtractor extractor,
                                DocumentMapper mapper,
                                StoreMetrics metrics) {
        this.documentRepository = documentRepository;
        this.historyRepository = historyRepository;
        this.indexTableService = indexTableService;
        this.extractor = extractor;
        this.mapper = mapper;
        this.metrics = metrics;
    }

    /**
     * Write a document without an expected-version check.
     */
    @Transactional
    public Document write(String type, String id, JsonNode body) {
        return write(type, id, body, null);
    }

    /**
     * Write a new version of a document.
     *
     * @param type            the document type
     * @param id              the document id, or null to create under a generated id
     * @param body            the JSON object to store
     * @param expectedVersion the version the caller last read, or null to skip the check;
     *                        0 asserts that the key does not exist yet
     * @return the stored version
     * @throws VersionConflictException    if the expected version is not current
     * @throws ExtractionFailureException  if a search rule rejects a value of the body
     */
    @Transactional
    public Document write(String type, String id, JsonNode body, Integer expectedVersion) {
        String resourceId = id != null ? id : UUID.randomUUID().toString();
        ObjectNode validated = StructuralValidator.validate(type, resourceId, body);

        // Extraction reads the store to resolve untyped references, so it runs before the row lock
        ExtractionResult extraction = extract(type, resourceId, validated);
        String content = mapper.toJson(validated);
        Instant now = now();

        try {
            Optional<DocumentEntity> current = documentRepository.findForUpdate(type, resourceId);
            UUID documentId;
            int version;
            HistoryOperation operation;

            if (current.isEmpty()) {
                if (expectedVersion != null && expectedVersion != 0) {
                    throw conflict(type, resourceId, expectedVersion, null);
                }
                DocumentEntity entity = DocumentEntity.builder()
                        .resourceType(type)
                        .resourceId(resourceId)
                        .versionId(1)
                        .isDeleted(false)
                        .content(content)
                        .lastUpdated(now)
                        .createdAt(now)
                        .build();
                documentId = documentRepository.saveAndFlush(entity).getId();
                version = 1;
                operation = HistoryOperation.CREATE;
            } else {
                DocumentEntity entity = current.get();
                int currentVersion = entity.getVersionId();
                if (expectedVersion != null && expectedVersion != currentVersion) {
                    throw conflict(type, resourceId, expectedVersion, currentVersion);
                }
                documentId = entity.getId();
                version = currentVersion + 1;
                operation = HistoryOperation.UPDATE;
                if (documentRepository.advanceVersion(documentId, currentVersion, version, false, content, now) == 0) {
                    throw conflict(type, resourceId, expectedVersion, currentVersion);
                }
            }

            appendHistory(documentId, type, resourceId, version, operation, content, now);
            indexTableService.replace(documentId, type, resourceId, extraction);

            metrics.recordWrite(type, operation);
            if (operation == HistoryOperation.CREATE) {
                log.info("Created {}/{} version {}", type, resourceId, version);
            } else {
                log.info("Updated {}/{} to version {}", type, resourceId, version);
            }
            return new Document(type, resourceId, version, now, false, validated.deepCopy());

        } catch (DataIntegrityViolationException e) {
            throw translate(e, type, resourceId);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Concurrent write on {}/{}: {}", type, resourceId, e.getMessage());
            metrics.recordConflict(type);
            throw new VersionConflictException(type, resourceId, e);
        }
    }

    /**
     * Soft-delete a document by writing a tombstone version.
     *
     * @throws ResourceNotFoundException if the key is absent or already deleted
     * @throws VersionConflictException  if the expected version is not current
     */
    @Transactional
    public Document softDelete(String type, String id, Integer expectedVersion) {
        StructuralValidator.validateType(type);
        StructuralValidator.validateId(id);
        Instant now = now();

        try {
            DocumentEntity entity = documentRepository.findForUpdate(type, id)
                    .filter(found -> !Boolean.TRUE.equals(found.getIsDeleted()))
                    .orElseThrow(() -> new ResourceNotFoundException(type, id));

            int currentVersion = entity.getVersionId();
            if (expectedVersion != null && expectedVersion != currentVersion) {
                throw conflict(type, id, expectedVersion, currentVersion);
            }
            int version = currentVersion + 1;
            UUID documentId = entity.getId();
            if (documentRepository.advanceVersion(documentId, currentVersion, version, true, TOMBSTONE_CONTENT, now) == 0) {
                throw conflict(type, id, expectedVersion, currentVersion);
            }

            appendHistory(documentId, type, id, version, HistoryOperation.DELETE, TOMBSTONE_CONTENT, now);
            indexTableService.clear(documentId);

            metrics.recordWrite(type, HistoryOperation.DELETE);
            log.info("Deleted {}/{} at version {}", type, id, version);
            return new Document(type, id, version, now, true, mapper.emptyBody());

        } catch (DataIntegrityViolationException e) {
            throw translate(e, type, id);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Concurrent delete on {}/{}: {}", type, id, e.getMessage());
            metrics.recordConflict(type);
            throw new VersionConflictException(type, id, e);
        }
    }

    /**
     * Read the current, non-deleted version of a document.
     */
    @Transactional(readOnly = true)
    public Document read(String type, String id) {
        return read(type, id, false);
    }

    /**
     * Read the current version of a document, optionally returning its tombstone.
     */
    @Transactional(readOnly = true)
    public Document read(String type, String id, boolean includeDeleted) {
        return documentRepository.findByResourceTypeAndResourceId(type, id)
                .filter(entity -> includeDeleted || !Boolean.TRUE.equals(entity.getIsDeleted()))
                .map(mapper::toDocument)
                .orElseThrow(() -> new ResourceNotFoundException(type, id));
    }

    /**
     * Read a specific version from the history ledger; tombstone versions included.
     */
    @Transactional(readOnly = true)
    public Document readVersion(String type, String id, int version) {
        return historyRepository.findByResourceTypeAndResourceIdAndVersionId(type, id, version)
                .map(mapper::toHistoryEntry)
                .map(HistoryEntry::toDocument)
                .orElseThrow(() -> new ResourceNotFoundException(type, id, version));
    }

    /**
     * All versions of a document, oldest first.
     */
    @Transactional(readOnly = true)
    public List<HistoryEntry> history(String type, String id) {
        List<HistoryEntry> entries = historyRepository.findByResourceTypeAndResourceIdOrderByVersionIdAsc(type, id)
                .stream()
                .map(mapper::toHistoryEntry)
                .toList();
        if (entries.isEmpty()) {
            throw new ResourceNotFoundException(type, id);
        }
        return entries;
    }

    /**
     * Versions of a document written at or after {@code since}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<HistoryEntry> history(String type, String id, Instant since) {
        if (historyRepository.countByResourceTypeAndResourceId(type, id) == 0) {
            throw new ResourceNotFoundException(type, id);
        }
        return historyRepository
                .findByResourceTypeAndResourceIdAndWrittenAtGreaterThanEqualOrderByVersionIdAsc(type, id, since)
                .stream()
                .map(mapper::toHistoryEntry)
                .toList();
    }

    private ExtractionResult extract(String type, String id, ObjectNode body) {
        try {
            return extractor.extract(type, body);
        } catch (ExtractionFailureException e) {
            log.error("Extraction failed for {}/{} on rule '{}': {}", type, id, e.getRuleName(), e.getDiagnostics());
            metrics.recordExtractionFailure(type, e.getRuleName());
            throw e.forDocument(id);
        }
    }

    private void appendHistory(UUID documentId, String type, String id, int version,
                               HistoryOperation operation, String content, Instant writtenAt) {
        DocumentHistoryEntity entry = DocumentHistoryEntity.builder()
                .documentId(documentId)
                .resourceType(type)
                .resourceId(id)
                .versionId(version)
                .operation(operation)
                .content(content)
                .writtenAt(writtenAt)
                .build();
        historyRepository.saveAndFlush(entry);
    }

    /**
     * A duplicate document key or history version means another writer won the race for
     * this key. Any other integrity violation is a storage failure that a retry will not fix.
     */
    private ClinidexException translate(DataIntegrityViolationException e, String type, String id) {
        if (isKeyCollision(e)) {
            log.warn("Concurrent write on {}/{}: {}", type, id, e.getMessage());
            metrics.recordConflict(type);
            return new VersionConflictException(type, id, e);
        }
        log.error("Storage rejected {}/{}: {}", type, id, e.getMostSpecificCause().getMessage());
        return new ClinidexException(String.format("Storage rejected '%s/%s'", type, id),
                "processing", e.getMostSpecificCause().getMessage(), e);
    }

    static boolean isKeyCollision(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            String message = cause.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            if (KEY_CONSTRAINTS.stream().anyMatch(lower::contains)) {
                return true;
            }
        }
        return false;
    }

    private VersionConflictException conflict(String type, String id, Integer expected, Integer actual) {
        log.warn("Version conflict on {}/{}: expected {}, current {}", type, id, expected, actual);
        metrics.recordConflict(type);
        return new VersionConflictException(type, id, expected, actual);
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
