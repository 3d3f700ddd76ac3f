package org.clinidex.persistence.entity;

import jakarta.persistence.*;
import lombok.*;
import org.clinidex.core.document.HistoryOperation;

import java.time.Instant;
import java.util.UUID;

/**
 * One version of a document as written. Rows are inserted once and never updated.
 */
@Entity
@Table(name = "clx_document_history",
        uniqueConstraints = @UniqueConstraint(name = "uk_clx_history_version", columnNames = {"document_id", "version_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 100)
    private String resourceType;

    @Column(name = "resource_id", nullable = false, updatable = false, length = 64)
    private String resourceId;

    @Column(name = "version_id", nullable = false, updatable = false)
    private Integer versionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, updatable = false, length = 16)
    private HistoryOperation operation;

    @Column(name = "content", nullable = false, updatable = false)
    private String content;

    @Column(name = "written_at", nullable = false, updatable = false)
    private Instant writtenAt;
}
