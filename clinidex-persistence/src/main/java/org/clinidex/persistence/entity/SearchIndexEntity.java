package org.clinidex.persistence.entity;

import jakarta.persistence.*;
import lombok.*;
import org.clinidex.core.rules.ParameterKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One extracted search value. Only the slot group matching {@link #paramKind} is set.
 */
@Entity
@Table(name = "clx_search_index", indexes = {
        @Index(name = "idx_clx_search_document", columnList = "document_id"),
        @Index(name = "idx_clx_search_type_param", columnList = "resource_type, param_name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchIndexEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "document_id", nullable = false)
    private UUID documentId;

    @Column(name = "resource_type", nullable = false, length = 100)
    private String resourceType;

    @Column(name = "param_name", nullable = false, length = 128)
    private String paramName;

    @Enumerated(EnumType.STRING)
    @Column(name = "param_kind", nullable = false, length = 16)
    private ParameterKind paramKind;

    @Column(name = "component", length = 128)
    private String component;

    @Column(name = "occurrence", length = 160)
    private String occurrence;

    @Column(name = "value_string")
    private String valueString;

    @Column(name = "value_string_lower")
    private String valueStringLower;

    @Column(name = "value_number", precision = 38, scale = 10)
    private BigDecimal valueNumber;

    @Column(name = "value_date_start")
    private Instant valueDateStart;

    @Column(name = "value_date_end")
    private Instant valueDateEnd;

    @Column(name = "value_token_system")
    private String valueTokenSystem;

    @Column(name = "value_token_code")
    private String valueTokenCode;

    @Column(name = "value_reference_type")
    private String valueReferenceType;

    @Column(name = "value_reference_id")
    private String valueReferenceId;
}
