package org.clinidex.persistence.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * An outbound pointer from a document, used for reverse-chained search.
 */
@Entity
@Table(name = "clx_reference_edge", indexes = {
        @Index(name = "idx_clx_edge_document", columnList = "document_id"),
        @Index(name = "idx_clx_edge_target", columnList = "target_id, field_path")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReferenceEdgeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "document_id", nullable = false)
    private UUID documentId;

    @Column(name = "source_type", nullable = false, length = 100)
    private String sourceType;

    @Column(name = "source_id", nullable = false, length = 64)
    private String sourceId;

    @Column(name = "target_type")
    private String targetType;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Column(name = "field_path", nullable = false)
    private String fieldPath;
}
