package org.clinidex.persistence.service;

import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.exception.ExtractionFailureException;
import org.clinidex.core.extract.ExtractionResult;
import org.clinidex.core.extract.ParameterExtractor;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.repository.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Rebuilds index rows and reference edges from the stored documents.
 * <p>
 * Needed after the rule table changes. Each document is reindexed in its own
 * transaction under its row lock, so concurrent writers are never blocked for
 * longer than one document takes.
 * </p>
 */
@Service
public class ReindexService {

    private static final Logger log = LoggerFactory.getLogger(ReindexService.class);

    private final DocumentRepository documentRepository;
    private final IndexTableService indexTableService;
    private final ParameterExtractor extractor;
    private final DocumentMapper mapper;
    private final TransactionTemplate transactionTemplate;

    public ReindexService(DocumentRepository documentRepository,
                          IndexTableService indexTableService,
                          ParameterExtractor extractor,
                          DocumentMapper mapper,
                          PlatformTransactionManager transactionManager) {
        this.documentRepository = documentRepository;
        this.indexTableService = indexTableService;
        this.extractor = extractor;
        this.mapper = mapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Reindex every document of one type, or of all types when {@code type} is null.
     */
    public ReindexResult reindex(String type) {
        List<UUID> ids = type == null ? documentRepository.findAllIds() : documentRepository.findIdsByResourceType(type);
        log.info("Reindexing {} documents{}", ids.size(), type == null ? "" : " of type " + type);

        int processed = 0;
        List<String> failures = new ArrayList<>();
        for (UUID id : ids) {
            try {
                transactionTemplate.executeWithoutResult(status -> reindexOne(id));
                processed++;
            } catch (ClinidexException e) {
                log.error("Reindex of document {} failed: {}", id, e.getMessage());
                failures.add(e.getMessage());
            }
        }

        log.info("Reindex finished: {} documents processed, {} failed", processed, failures.size());
        return new ReindexResult(processed, failures);
    }

    private void reindexOne(UUID id) {
        DocumentEntity found = documentRepository.findById(id).orElse(null);
        if (found == null) {
            return;
        }
        DocumentEntity entity = documentRepository.findForUpdate(found.getResourceType(), found.getResourceId())
                .orElse(found);
        if (Boolean.TRUE.equals(entity.getIsDeleted())) {
            indexTableService.clear(entity.getId());
            return;
        }
        ExtractionResult extraction;
        try {
            extraction = extractor.extract(entity.getResourceType(), mapper.parseBody(entity.getContent()));
        } catch (ExtractionFailureException e) {
            throw e.forDocument(entity.getResourceId());
        }
        indexTableService.replace(entity.getId(), entity.getResourceType(), entity.getResourceId(), extraction);
    }

    /**
     * Outcome of a reindex run.
     *
     * @param processed documents reindexed
     * @param failures  one message per document whose extraction failed; its old rows are kept
     */
    public record ReindexResult(int processed, List<String> failures) {

        public ReindexResult {
            failures = List.copyOf(failures);
        }
    }
}
