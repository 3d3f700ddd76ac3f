package org.clinidex.core.extract;

import org.clinidex.core.reference.CanonicalRef;
import org.clinidex.core.rules.ParameterKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One typed, searchable value extracted from a document.
 * <p>
 * Exactly the slot group matching {@link #kind()} is populated. Rows that belong to a
 * composite parameter carry the component name and an occurrence key shared by every
 * component taken from the same repeated element.
 * </p>
 */
public record IndexRow(
        String parameter,
        ParameterKind kind,
        String component,
        String occurrence,
        String text,
        BigDecimal number,
        Instant rangeStart,
        Instant rangeEnd,
        String system,
        String code,
        String referenceType,
        String referenceId
) {

    public IndexRow {
        if (number != null) {
            number = number.stripTrailingZeros();
        }
    }

    public static IndexRow string(String parameter, String text) {
        return new IndexRow(parameter, ParameterKind.STRING, null, null, text, null, null, null, null, null, null, null);
    }

    public static IndexRow number(String parameter, BigDecimal number) {
        return new IndexRow(parameter, ParameterKind.NUMBER, null, null, null, number, null, null, null, null, null, null);
    }

    public static IndexRow date(String parameter, DateRange range) {
        return new IndexRow(parameter, ParameterKind.DATE, null, null, null, null, range.start(), range.end(), null, null, null, null);
    }

    public static IndexRow token(String parameter, String system, String code) {
        return new IndexRow(parameter, ParameterKind.TOKEN, null, null, null, null, null, null, system, code, null, null);
    }

    public static IndexRow reference(String parameter, CanonicalRef ref) {
        return new IndexRow(parameter, ParameterKind.REFERENCE, null, null, null, null, null, null, null, null,
                ref.typeOrNull(), ref.id());
    }

    /**
     * Re-tags this row as one component of a composite occurrence.
     */
    public IndexRow asComponent(String compositeName, String componentName, String occurrenceKey) {
        return new IndexRow(compositeName, kind, componentName, occurrenceKey, text, number, rangeStart, rangeEnd,
                system, code, referenceType, referenceId);
    }

    public CanonicalRef reference() {
        return referenceId == null ? null : CanonicalRef.of(referenceType, referenceId);
    }
}
