package org.clinidex.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.clinidex.core.exception.MalformedDocumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class StructuralValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    @DisplayName("Should accept a body whose declared type and id agree with the key")
    void validate_MatchingEnvelope_ReturnsBody() throws Exception {
        JsonNode body = json("{\"resourceType\": \"Patient\", \"id\": \"p1\", \"active\": true}");

        assertSame(body, StructuralValidator.validate("Patient", "p1", body));
    }

    @Test
    void validate_NoEnvelopeFields_Accepted() throws Exception {
        assertDoesNotThrow(() -> StructuralValidator.validate("Patient", "p1", json("{\"active\": true}")));
    }

    @Test
    void validate_NonObjectBody_Rejected() throws Exception {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
                () -> StructuralValidator.validate("Patient", "p1", json("[]")));

        assertEquals("structure", e.getIssueCode());
        assertEquals("$", e.getFieldPath());
    }

    @Test
    void validate_MismatchedResourceType_Rejected() throws Exception {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
                () -> StructuralValidator.validate("Patient", "p1", json("{\"resourceType\": \"Observation\"}")));

        assertEquals("resourceType", e.getFieldPath());
    }

    @Test
    void validate_MismatchedId_Rejected() throws Exception {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
                () -> StructuralValidator.validate("Patient", "p1", json("{\"id\": \"p2\"}")));

        assertEquals("id", e.getFieldPath());
    }

    @ParameterizedTest
    @ValueSource(strings = {"patient", "Pa tient", "1Patient", ""})
    void validateType_Invalid_Rejected(String type) {
        assertThrows(MalformedDocumentException.class, () -> StructuralValidator.validateType(type));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a/b", "with space", "",
            "01234567890123456789012345678901234567890123456789012345678901234"})
    void validateId_Invalid_Rejected(String id) {
        assertThrows(MalformedDocumentException.class, () -> StructuralValidator.validateId(id));
    }

    @Test
    void validateId_AllowedCharacters_Accepted() {
        assertDoesNotThrow(() -> StructuralValidator.validateId("abc-123.X"));
    }
}
