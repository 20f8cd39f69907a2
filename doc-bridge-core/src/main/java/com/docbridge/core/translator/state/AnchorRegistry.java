package com.docbridge.core.translator.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Registry of anchor identifiers already declared in the output.
 *
 * <p>A colliding candidate gets {@value #DUPLICATE_SUFFIX} appended, repeatedly, until the
 * result is unused. Every collision is logged, and {@link #declare(String)} reports each
 * attempt so the output shows the chain of renames.
 */
public final class AnchorRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnchorRegistry.class);

    /** Suffix appended to a colliding identifier. */
    public static final String DUPLICATE_SUFFIX = "-duplicate";

    private final Set<String> identifiers = new LinkedHashSet<>();

    /**
     * Registers an identifier and returns every identifier to declare for it.
     *
     * <p>Without a collision the result is just the candidate. Each collision adds the
     * suffixed identifier that was tried, and the identifier finally accepted is declared
     * once more at the end: {@code intro} taken gives
     * {@code [intro-duplicate, intro-duplicate]}.
     *
     * @param candidate requested identifier
     * @return declarations in output order; the last one is the registered identifier
     */
    public List<String> declare(String candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        List<String> declarations = new ArrayList<>();
        String identifier = candidate;
        while (!identifiers.add(identifier)) {
            String next = identifier + DUPLICATE_SUFFIX;
            log.warn("Anchor id '{}' is already declared, trying '{}'", identifier, next);
            declarations.add(next);
            identifier = next;
        }
        declarations.add(identifier);
        return List.copyOf(declarations);
    }

    /**
     * Registers an identifier, disambiguating it if it is already taken.
     *
     * @param candidate requested identifier
     * @return the identifier actually registered, unique within this registry
     */
    public String register(String candidate) {
        List<String> declarations = declare(candidate);
        return declarations.get(declarations.size() - 1);
    }

    public boolean contains(String identifier) {
        return identifiers.contains(identifier);
    }

    /**
     * Returns the registered identifiers in registration order.
     *
     * @return read-only view of the identifiers
     */
    public Set<String> identifiers() {
        return Collections.unmodifiableSet(identifiers);
    }
}
