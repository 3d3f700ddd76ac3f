package org.clinidex.persistence.service;

import org.clinidex.core.exception.ResourceNotFoundException;
import org.clinidex.core.extract.ExtractionResult;
import org.clinidex.core.extract.IndexRow;
import org.clinidex.core.extract.ReferenceEdge;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.ReferenceEdgeEntity;
import org.clinidex.persistence.entity.SearchIndexEntity;
import org.clinidex.persistence.repository.DocumentRepository;
import org.clinidex.persistence.repository.ReferenceEdgeRepository;
import org.clinidex.persistence.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Maintains the derived index rows and reference edges of each document.
 * <p>
 * Rows are never patched: every write deletes the document's rows and inserts the
 * freshly extracted set, inside the caller's transaction.
 * </p>
 */
@Service
public class IndexTableService {

    private static final Logger log = LoggerFactory.getLogger(IndexTableService.class);

    private final SearchIndexRepository searchIndexRepository;
    private final ReferenceEdgeRepository referenceEdgeRepository;
    private final DocumentRepository documentRepository;
    private final DocumentMapper mapper;

    public IndexTableService(SearchIndexRepository searchIndexRepository,
                             ReferenceEdgeRepository referenceEdgeRepository,
                             DocumentRepository documentRepository,
                             DocumentMapper mapper) {
        this.searchIndexRepository = searchIndexRepository;
        this.referenceEdgeRepository = referenceEdgeRepository;
        this.documentRepository = documentRepository;
        this.mapper = mapper;
    }

    /**
     * Replaces the rows and edges of a document with a new extraction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void replace(UUID documentId, String resourceType, String resourceId, ExtractionResult extraction) {
        clear(documentId);

        List<SearchIndexEntity> rows = extraction.rows().stream()
                .map(row -> mapper.toIndexEntity(documentId, resourceType, row))
                .toList();
        List<ReferenceEdgeEntity> edges = extraction.edges().stream()
                .map(edge -> mapper.toEdgeEntity(documentId, resourceType, resourceId, edge))
                .toList();
        searchIndexRepository.saveAll(rows);
        referenceEdgeRepository.saveAll(edges);

        log.debug("Indexed {}/{}: {} rows, {} edges", resourceType, resourceId, rows.size(), edges.size());
    }

    /**
     * Removes every row and edge of a document, as on soft delete.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void clear(UUID documentId) {
        searchIndexRepository.deleteByDocumentId(documentId);
        referenceEdgeRepository.deleteByDocumentId(documentId);
    }

    /**
     * Reads back what the index tables hold for a key, in insertion order.
     */
    @Transactional(readOnly = true)
    public ExtractionResult snapshot(String resourceType, String resourceId) {
        DocumentEntity document = documentRepository.findByResourceTypeAndResourceId(resourceType, resourceId)
                .orElseThrow(() -> new ResourceNotFoundException(resourceType, resourceId));

        List<IndexRow> rows = searchIndexRepository.findByDocumentIdOrderByIdAsc(document.getId()).stream()
                .map(mapper::toIndexRow)
                .toList();
        List<ReferenceEdge> edges = referenceEdgeRepository.findByDocumentIdOrderByIdAsc(document.getId()).stream()
                .map(mapper::toReferenceEdge)
                .toList();
        return new ExtractionResult(rows, edges);
    }
}
