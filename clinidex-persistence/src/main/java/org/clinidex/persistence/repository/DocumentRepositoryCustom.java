package org.clinidex.persistence.repository;

import org.clinidex.core.search.SearchRequest;
import org.clinidex.persistence.entity.DocumentEntity;
import org.springframework.data.domain.Page;

/**
 * Search over the index tables.
 */
public interface DocumentRepositoryCustom {

    /**
     * Returns one page of documents matching every predicate of the request, with the total match count.
     *
     * @param request  the search, already validated for page bounds
     * @param pageSize the number of documents to return; 0 only counts
     */
    Page<DocumentEntity> search(SearchRequest request, int pageSize);
}
