package org.clinidex.persistence.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.clinidex.core.document.Document;
import org.clinidex.core.document.HistoryEntry;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.core.extract.IndexRow;
import org.clinidex.core.extract.ReferenceEdge;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.DocumentHistoryEntity;
import org.clinidex.persistence.entity.ReferenceEdgeEntity;
import org.clinidex.persistence.entity.SearchIndexEntity;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Converts between stored rows and the core document and index records.
 */
@Component
public class DocumentMapper {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String toJson(JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document body", e);
        }
    }

    public ObjectNode parseBody(String content) {
        try {
            JsonNode node = objectMapper.readTree(content);
            if (!node.isObject()) {
                throw new ClinidexException("Stored content is not a JSON object", "exception");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new ClinidexException("Stored content is not valid JSON", "exception", e.getOriginalMessage(), e);
        }
    }

    public ObjectNode emptyBody() {
        return objectMapper.createObjectNode();
    }

    public Document toDocument(DocumentEntity entity) {
        return new Document(
                entity.getResourceType(),
                entity.getResourceId(),
                entity.getVersionId(),
                entity.getLastUpdated(),
                Boolean.TRUE.equals(entity.getIsDeleted()),
                parseBody(entity.getContent()));
    }

    public HistoryEntry toHistoryEntry(DocumentHistoryEntity entity) {
        return new HistoryEntry(
                entity.getResourceType(),
                entity.getResourceId(),
                entity.getVersionId(),
                entity.getOperation(),
                parseBody(entity.getContent()),
                entity.getWrittenAt());
    }

    public SearchIndexEntity toIndexEntity(UUID documentId, String resourceType, IndexRow row) {
        return SearchIndexEntity.builder()
                .documentId(documentId)
                .resourceType(resourceType)
                .paramName(row.parameter())
                .paramKind(row.kind())
                .component(row.component())
                .occurrence(row.occurrence())
                .valueString(row.text())
                .valueStringLower(row.text() != null ? row.text().toLowerCase(Locale.ROOT) : null)
                .valueNumber(row.number())
                .valueDateStart(row.rangeStart())
                .valueDateEnd(row.rangeEnd())
                .valueTokenSystem(row.system())
                .valueTokenCode(row.code())
                .valueReferenceType(row.referenceType())
                .valueReferenceId(row.referenceId())
                .build();
    }

    public IndexRow toIndexRow(SearchIndexEntity entity) {
        return new IndexRow(
                entity.getParamName(),
                entity.getParamKind(),
                entity.getComponent(),
                entity.getOccurrence(),
                entity.getValueString(),
                entity.getValueNumber(),
                entity.getValueDateStart(),
                entity.getValueDateEnd(),
                entity.getValueTokenSystem(),
                entity.getValueTokenCode(),
                entity.getValueReferenceType(),
                entity.getValueReferenceId());
    }

    public ReferenceEdgeEntity toEdgeEntity(UUID documentId, String sourceType, String sourceId, ReferenceEdge edge) {
        return ReferenceEdgeEntity.builder()
                .documentId(documentId)
                .sourceType(sourceType)
                .sourceId(sourceId)
                .targetType(edge.targetType())
                .targetId(edge.targetId())
                .fieldPath(edge.fieldPath())
                .build();
    }

    public ReferenceEdge toReferenceEdge(ReferenceEdgeEntity entity) {
        return new ReferenceEdge(entity.getTargetType(), entity.getTargetId(), entity.getFieldPath());
    }
}
