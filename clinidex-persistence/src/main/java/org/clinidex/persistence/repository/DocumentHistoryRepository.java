package org.clinidex.persistence.repository;

import org.clinidex.persistence.entity.DocumentHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA Repository for the append-only history ledger.
 */
@Repository
public interface DocumentHistoryRepository extends JpaRepository<DocumentHistoryEntity, UUID> {

    Optional<DocumentHistoryEntity> findByResourceTypeAndResourceIdAndVersionId(
            String resourceType, String resourceId, Integer versionId);

    List<DocumentHistoryEntity> findByResourceTypeAndResourceIdOrderByVersionIdAsc(
            String resourceType, String resourceId);

    List<DocumentHistoryEntity> findByResourceTypeAndResourceIdAndWrittenAtGreaterThanEqualOrderByVersionIdAsc(
            String resourceType, String resourceId, Instant since);

    long countByResourceTypeAndResourceId(String resourceType, String resourceId);
}
