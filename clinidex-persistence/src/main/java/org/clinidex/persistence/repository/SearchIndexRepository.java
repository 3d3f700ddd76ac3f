package org.clinidex.persistence.repository;

import org.clinidex.core.rules.ParameterKind;
import org.clinidex.persistence.entity.SearchIndexEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * JPA Repository for extracted index rows.
 */
@Repository
public interface SearchIndexRepository extends JpaRepository<SearchIndexEntity, Long> {

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM SearchIndexEntity s WHERE s.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") UUID documentId);

    List<SearchIndexEntity> findByDocumentIdOrderByIdAsc(UUID documentId);

    /**
     * Reference rows of one parameter on a set of documents, for {@code _include}.
     */
    List<SearchIndexEntity> findByDocumentIdInAndParamNameAndParamKind(
            Collection<UUID> documentIds, String paramName, ParameterKind paramKind);

    /**
     * Reference rows of one parameter pointing at any of the given ids, for {@code _revinclude}.
     */
    List<SearchIndexEntity> findByResourceTypeAndParamNameAndValueReferenceIdIn(
            String resourceType, String paramName, Collection<String> referenceIds);

    /**
     * Token rows of one parameter carrying the given code, for resolving untyped references.
     */
    List<SearchIndexEntity> findByParamNameAndParamKindAndValueTokenCode(
            String paramName, ParameterKind paramKind, String valueTokenCode);
}
