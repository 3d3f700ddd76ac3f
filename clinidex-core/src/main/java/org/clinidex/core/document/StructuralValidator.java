package org.clinidex.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.clinidex.core.exception.MalformedDocumentException;

import java.util.regex.Pattern;

/**
 * Structural well-formedness checks applied before a document is written.
 * <p>
 * Only the shape of the key and the envelope of the body are checked:
 * the body must be a JSON object, and any {@code resourceType} or {@code id}
 * it declares must agree with the key it is written under.
 * </p>
 */
public final class StructuralValidator {

    private static final Pattern TYPE_PATTERN = Pattern.compile("^[A-Z][A-Za-z0-9]*$");
    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9\\-.]{1,64}$");

    private StructuralValidator() {
    }

    public static void validateType(String type) {
        if (type == null || !TYPE_PATTERN.matcher(type).matches()) {
            throw new MalformedDocumentException("Invalid resource type: " + type, "resourceType");
        }
    }

    public static void validateId(String id) {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new MalformedDocumentException("Invalid resource id: " + id, "id");
        }
    }

    /**
     * Validates the key and body of a write and returns the body as an object node.
     */
    public static ObjectNode validate(String type, String id, JsonNode body) {
        validateType(type);
        validateId(id);
        if (body == null || !body.isObject()) {
            throw new MalformedDocumentException(
                    "Document body must be a JSON object, got " + (body == null ? "nothing" : body.getNodeType()),
                    "$");
        }

        JsonNode declaredType = body.get("resourceType");
        if (declaredType != null && !declaredType.isNull()
                && (!declaredType.isTextual() || !declaredType.asText().equals(type))) {
            throw new MalformedDocumentException(
                    String.format("Body declares resourceType '%s' but was written as %s",
                            declaredType.asText(), type),
                    "resourceType");
        }

        JsonNode declaredId = body.get("id");
        if (declaredId != null && !declaredId.isNull()
                && (!declaredId.isTextual() || !declaredId.asText().equals(id))) {
            throw new MalformedDocumentException(
                    String.format("Body declares id '%s' but was written as %s", declaredId.asText(), id),
                    "id");
        }

        return (ObjectNode) body;
    }
}
