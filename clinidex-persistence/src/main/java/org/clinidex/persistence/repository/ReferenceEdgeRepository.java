package org.clinidex.persistence.repository;

import org.clinidex.persistence.entity.ReferenceEdgeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * JPA Repository for outbound reference edges.
 */
@Repository
public interface ReferenceEdgeRepository extends JpaRepository<ReferenceEdgeEntity, Long> {

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ReferenceEdgeEntity e WHERE e.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") UUID documentId);

    List<ReferenceEdgeEntity> findByDocumentIdOrderByIdAsc(UUID documentId);
}
