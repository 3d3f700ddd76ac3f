package org.clinidex.core.reference;

import java.util.Optional;

/**
 * Looks up the type of an untyped reference against the stored documents.
 */
@FunctionalInterface
public interface UntypedReferenceResolver {

    /**
     * Resolver that never resolves; untyped references stay untyped.
     */
    UntypedReferenceResolver NONE = token -> Optional.empty();

    /**
     * Resolves an opaque token to the single document it identifies.
     *
     * @param token the id carried by an untyped reference
     * @return the typed reference, or empty when no document or more than one matches
     */
    Optional<CanonicalRef.Typed> resolve(String token);
}
