package org.clinidex.core.extract;

import org.clinidex.core.reference.CanonicalRef;

/**
 * An outbound pointer found in a document, whether or not a search rule covers it.
 *
 * @param targetType null when the pointer does not say what it points at
 * @param targetId   the id of the target
 * @param fieldPath  dotted path of the object holding the pointer, without array positions
 */
public record ReferenceEdge(String targetType, String targetId, String fieldPath) {

    public static ReferenceEdge of(CanonicalRef target, String fieldPath) {
        return new ReferenceEdge(target.typeOrNull(), target.id(), fieldPath);
    }

    public CanonicalRef target() {
        return CanonicalRef.of(targetType, targetId);
    }
}
