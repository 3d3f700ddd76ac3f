package org.clinidex.core.reference;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes the encodings a document may use for a pointer to another document.
 * <ul>
 *   <li>{@code Patient/123}, optionally followed by {@code /_history/n}: typed</li>
 *   <li>{@code https://host/base/Patient/123}: typed, from the trailing segments</li>
 *   <li>{@code urn:uuid:...}, {@code urn:oid:...} and bare tokens: untyped</li>
 *   <li>{@code #local} pointers into contained resources: not a reference</li>
 * </ul>
 * Normalization is pure; resolving untyped references is left to an
 * {@link UntypedReferenceResolver}.
 */
public class ReferenceNormalizer {

    private static final String TYPE = "([A-Z][A-Za-z0-9]*)";
    private static final String ID = "([A-Za-z0-9\\-.]{1,64})";
    private static final String HISTORY = "(?:/_history/[^/]+)?";

    private static final Pattern RELATIVE = Pattern.compile("^" + TYPE + "/" + ID + HISTORY + "$");
    private static final Pattern ABSOLUTE = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.\\-]*://.*/" + TYPE + "/" + ID + HISTORY + "/?$");
    private static final Pattern URN = Pattern.compile("^urn:(?:uuid|oid):(.+)$", Pattern.CASE_INSENSITIVE);

    /**
     * Normalizes a raw pointer string.
     *
     * @param raw the pointer as found in a document or a query
     * @return the canonical reference, or empty for blank input and contained-resource pointers
     */
    public Optional<CanonicalRef> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty() || value.startsWith("#")) {
            return Optional.empty();
        }

        Matcher relative = RELATIVE.matcher(value);
        if (relative.matches()) {
            return Optional.of(new CanonicalRef.Typed(relative.group(1), relative.group(2)));
        }

        Matcher absolute = ABSOLUTE.matcher(value);
        if (absolute.matches()) {
            return Optional.of(new CanonicalRef.Typed(absolute.group(1), absolute.group(2)));
        }

        Matcher urn = URN.matcher(value);
        if (urn.matches()) {
            return Optional.of(new CanonicalRef.Untyped(urn.group(1)));
        }

        // An address that does not end in Type/id still names its target by the last segment
        if (value.contains("/")) {
            String[] segments = value.split("/");
            for (int i = segments.length - 1; i >= 0; i--) {
                if (!segments[i].isEmpty()) {
                    return Optional.of(new CanonicalRef.Untyped(segments[i]));
                }
            }
            return Optional.empty();
        }

        return Optional.of(new CanonicalRef.Untyped(value));
    }

    /**
     * Normalizes and then resolves untyped results through the given resolver.
     */
    public Optional<CanonicalRef> normalize(String raw, UntypedReferenceResolver resolver) {
        return normalize(raw).map(ref -> {
            if (ref instanceof CanonicalRef.Untyped untyped && resolver != null) {
                return resolver.resolve(untyped.id()).<CanonicalRef>map(typed -> typed).orElse(ref);
            }
            return ref;
        });
    }
}
