package org.clinidex.core.reference;

/**
 * The single normalized form of a pointer from one document to another.
 * <p>
 * A {@link Typed} reference names both the target type and id. An {@link Untyped}
 * reference only carries an id, because the original encoding (an opaque token,
 * a {@code urn:uuid}) did not say which type it points at.
 * </p>
 */
public sealed interface CanonicalRef permits CanonicalRef.Typed, CanonicalRef.Untyped {

    String id();

    /**
     * Returns the target type, or {@code null} for an untyped reference.
     */
    String typeOrNull();

    static CanonicalRef of(String type, String id) {
        return type == null ? new Untyped(id) : new Typed(type, id);
    }

    /**
     * Matches a stored reference against a query reference.
     * <p>
     * Ids must be equal. Types must be equal only when both sides carry one: an
     * untyped stored reference matches a query for any type with the same id, and
     * an untyped query matches stored references of every type. This may report a
     * match across unrelated types sharing an id, never a miss.
     * </p>
     */
    static boolean matches(CanonicalRef stored, CanonicalRef query) {
        if (stored == null || query == null || !stored.id().equals(query.id())) {
            return false;
        }
        if (stored instanceof Typed typedStored && query instanceof Typed typedQuery) {
            return typedStored.type().equals(typedQuery.type());
        }
        return true;
    }

    record Typed(String type, String id) implements CanonicalRef {

        @Override
        public String typeOrNull() {
            return type;
        }

        @Override
        public String toString() {
            return type + "/" + id;
        }
    }

    record Untyped(String id) implements CanonicalRef {

        @Override
        public String typeOrNull() {
            return null;
        }

        @Override
        public String toString() {
            return id;
        }
    }
}
