package org.clinidex.persistence.repository;

import jakarta.persistence.LockModeType;
import org.clinidex.persistence.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA Repository for current document versions.
 */
@Repository
public interface DocumentRepository extends JpaRepository<DocumentEntity, UUID>, DocumentRepositoryCustom {

    /**
     * Find the current version of a document, deleted or not.
     */
    Optional<DocumentEntity> findByResourceTypeAndResourceId(String resourceType, String resourceId);

    /**
     * Find the current version of a document and hold its row lock until the transaction ends.
     * Concurrent writers of the same key queue here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DocumentEntity d WHERE d.resourceType = :resourceType AND d.resourceId = :resourceId")
    Optional<DocumentEntity> findForUpdate(
            @Param("resourceType") String resourceType,
            @Param("resourceId") String resourceId);

    /**
     * Move a document to its next version, only if it is still at {@code currentVersion}.
     *
     * @return the number of rows changed, 0 when another writer advanced the version first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DocumentEntity d SET d.versionId = :nextVersion, d.isDeleted = :deleted, " +
           "d.content = :content, d.lastUpdated = :lastUpdated " +
           "WHERE d.id = :id AND d.versionId = :currentVersion")
    int advanceVersion(
            @Param("id") UUID id,
            @Param("currentVersion") Integer currentVersion,
            @Param("nextVersion") Integer nextVersion,
            @Param("deleted") Boolean deleted,
            @Param("content") String content,
            @Param("lastUpdated") Instant lastUpdated);

    /**
     * Find live documents of any type with the given id.
     */
    List<DocumentEntity> findByResourceIdAndIsDeletedFalse(String resourceId);

    List<DocumentEntity> findByResourceTypeAndResourceIdInAndIsDeletedFalse(String resourceType, Collection<String> resourceIds);

    List<DocumentEntity> findByResourceIdInAndIsDeletedFalse(Collection<String> resourceIds);

    long countByResourceTypeAndIsDeletedFalse(String resourceType);

    @Query("SELECT d.id FROM DocumentEntity d ORDER BY d.id")
    List<UUID> findAllIds();

    @Query("SELECT d.id FROM DocumentEntity d WHERE d.resourceType = :resourceType ORDER BY d.id")
    List<UUID> findIdsByResourceType(@Param("resourceType") String resourceType);
}
