package com.docbridge.core.translator.engine;

import com.docbridge.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Lookup table from node kind to rendering rule.
 *
 * <p>Kinds without a registered rule resolve to {@link NodeRule#NO_OP}. Registering a kind
 * twice is a programming error and fails fast.
 */
public final class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<NodeKind, NodeRule> rules = new EnumMap<>(NodeKind.class);
    private final Map<String, Set<NodeKind>> kindsByFamily = new LinkedHashMap<>();
    private String installingFamily = "custom";

    /**
     * Creates a registry holding the rules of the given families.
     *
     * @param families rule families, installed in order
     * @return populated registry
     */
    public static RuleRegistry of(List<? extends RuleFamily> families) {
        RuleRegistry registry = new RuleRegistry();
        families.forEach(registry::install);
        return registry;
    }

    /**
     * Installs all rules of a family.
     *
     * @param family rule family
     * @return this registry
     */
    public RuleRegistry install(RuleFamily family) {
        Objects.requireNonNull(family, "family must not be null");
        String previous = installingFamily;
        installingFamily = family.name();
        try {
            family.registerInto(this);
        } finally {
            installingFamily = previous;
        }
        log.debug("Installed rule family '{}' ({} kinds)", family.name(),
            kindsByFamily.getOrDefault(family.name(), Set.of()).size());
        return this;
    }

    /**
     * Registers a rule for a node kind.
     *
     * @param kind node kind
     * @param rule rule to apply
     * @return this registry
     * @throws IllegalStateException if the kind already has a rule
     */
    public RuleRegistry register(NodeKind kind, NodeRule rule) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        if (rules.putIfAbsent(kind, rule) != null) {
            throw new IllegalStateException("Rule already registered for node kind " + kind);
        }
        kindsByFamily.computeIfAbsent(installingFamily, name -> new TreeSet<>()).add(kind);
        return this;
    }

    /**
     * Registers the same rule for several kinds.
     *
     * @param kinds node kinds
     * @param rule rule to apply
     * @return this registry
     */
    public RuleRegistry register(Set<NodeKind> kinds, NodeRule rule) {
        kinds.forEach(kind -> register(kind, rule));
        return this;
    }

    /**
     * Resolves the rule for a node kind.
     *
     * @param kind node kind
     * @return registered rule, or {@link NodeRule#NO_OP}
     */
    public NodeRule ruleFor(NodeKind kind) {
        return rules.getOrDefault(kind, NodeRule.NO_OP);
    }

    public boolean hasRule(NodeKind kind) {
        return rules.containsKey(kind);
    }

    /**
     * Returns the registered kinds grouped by the family that registered them.
     *
     * @return family name to kinds, in installation order
     */
    public Map<String, Set<NodeKind>> kindsByFamily() {
        Map<String, Set<NodeKind>> view = new LinkedHashMap<>();
        kindsByFamily.forEach((family, kinds) -> view.put(family, Collections.unmodifiableSet(kinds)));
        return Collections.unmodifiableMap(view);
    }
}
