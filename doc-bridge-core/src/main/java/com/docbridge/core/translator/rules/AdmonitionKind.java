package com.docbridge.core.translator.rules;

import com.docbridge.core.model.NodeKind;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Admonition node kinds and the AsciiDoc label each one renders as.
 *
 * <p>AsciiDoc knows five admonition labels; the remaining docutils admonitions borrow the
 * closest one.
 */
public enum AdmonitionKind {
    NOTE(NodeKind.NOTE, "NOTE"),
    TIP(NodeKind.TIP, "TIP"),
    WARNING(NodeKind.WARNING, "WARNING"),
    IMPORTANT(NodeKind.IMPORTANT, "IMPORTANT"),
    CAUTION(NodeKind.CAUTION, "CAUTION"),
    HINT(NodeKind.HINT, "TIP"),
    ATTENTION(NodeKind.ATTENTION, "IMPORTANT"),
    DANGER(NodeKind.DANGER, "CAUTION"),
    ERROR(NodeKind.ERROR, "WARNING");

    private static final Map<NodeKind, AdmonitionKind> BY_NODE_KIND = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(AdmonitionKind::nodeKind, Function.identity()));

    private final NodeKind nodeKind;
    private final String label;

    AdmonitionKind(NodeKind nodeKind, String label) {
        this.nodeKind = nodeKind;
        this.label = label;
    }

    public NodeKind nodeKind() {
        return nodeKind;
    }

    public String label() {
        return label;
    }

    /**
     * Looks up the admonition for a node kind.
     *
     * @param kind node kind
     * @return admonition kind
     * @throws IllegalArgumentException if the kind is not an admonition
     */
    public static AdmonitionKind of(NodeKind kind) {
        AdmonitionKind admonition = BY_NODE_KIND.get(kind);
        if (admonition == null) {
            throw new IllegalArgumentException("Not an admonition: " + kind);
        }
        return admonition;
    }
}
