package com.docbridge.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * A node of the parsed document tree handed to the translator.
 *
 * <p>Nodes are immutable. Element nodes carry attributes and ordered children; text leaves
 * ({@link NodeKind#TEXT}) carry only a text payload. Attribute values are strings, and the
 * list-valued docutils attributes ({@code classes}, {@code ids}, {@code names}) are stored
 * whitespace-separated, exactly as docutils serializes them to XML.
 *
 * <p>Attribute accessors never throw for a missing attribute: absence is reported through
 * {@link Optional} or an empty list so rendering rules can treat it as "branch does not apply".
 *
 * @param kind node kind, {@link NodeKind#UNKNOWN} for unrecognised elements
 * @param tagName original element name (kept for diagnostics of unknown kinds)
 * @param attributes element attributes in document order
 * @param children ordered child nodes
 * @param text text payload for text leaves, null for elements
 */
public record DocNode(
    NodeKind kind,
    String tagName,
    Map<String, String> attributes,
    List<DocNode> children,
    String text
) {
    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "on");

    /**
     * Compact constructor with validation.
     */
    public DocNode {
        Objects.requireNonNull(kind, "kind must not be null");
        if (tagName == null) {
            tagName = kind.tagName();
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
        if (kind == NodeKind.TEXT) {
            Objects.requireNonNull(text, "text must not be null for text nodes");
        }
    }

    /**
     * Creates a text leaf.
     *
     * @param text text payload
     * @return text node
     */
    public static DocNode text(String text) {
        return new DocNode(NodeKind.TEXT, NodeKind.TEXT.tagName(), Map.of(), List.of(), text);
    }

    /**
     * Creates an element node of a known kind.
     *
     * @param kind node kind
     * @param attributes attributes, may be null
     * @param children children, may be null
     * @return element node
     */
    public static DocNode element(NodeKind kind, Map<String, String> attributes, List<DocNode> children) {
        return new DocNode(kind, kind.tagName(), attributes, children, null);
    }

    /**
     * Creates an element node from a docutils element name.
     *
     * @param tagName docutils element name
     * @param attributes attributes, may be null
     * @param children children, may be null
     * @return element node, of kind {@link NodeKind#UNKNOWN} when the name is not recognised
     */
    public static DocNode element(String tagName, Map<String, String> attributes, List<DocNode> children) {
        return new DocNode(NodeKind.fromTagName(tagName), tagName, attributes, children, null);
    }

    /**
     * Starts a builder for an element node.
     *
     * @param kind node kind
     * @return builder
     */
    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public boolean isText() {
        return kind == NodeKind.TEXT;
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    /**
     * Gets an attribute value.
     *
     * @param name attribute name
     * @return value, or empty if absent
     */
    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * Gets an attribute value that is present and not blank.
     *
     * @param name attribute name
     * @return non-blank value, or empty
     */
    public Optional<String> nonBlankAttribute(String name) {
        return attribute(name).filter(value -> !value.isBlank());
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * Splits a list-valued attribute such as {@code classes} into its entries.
     *
     * @param name attribute name
     * @return entries in order, empty if absent
     */
    public List<String> attributeValues(String name) {
        return attribute(name)
            .map(String::strip)
            .filter(value -> !value.isEmpty())
            .map(value -> Arrays.asList(value.split("\\s+")))
            .orElse(List.of());
    }

    /**
     * Reads a boolean attribute. Accepts {@code 1}, {@code true}, {@code yes}, {@code on}.
     *
     * @param name attribute name
     * @return true if present and truthy
     */
    public boolean flag(String name) {
        return attribute(name)
            .map(value -> TRUE_VALUES.contains(value.strip().toLowerCase(Locale.ROOT)))
            .orElse(false);
    }

    /**
     * Reads an integer attribute.
     *
     * @param name attribute name
     * @return parsed value, or empty when absent or not a number
     */
    public OptionalInt intAttribute(String name) {
        Optional<String> value = nonBlankAttribute(name);
        if (value.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            // colwidth may be serialized as a float ("30.0")
            return OptionalInt.of((int) Math.round(Double.parseDouble(value.get().strip())));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Concatenates the text of all text leaves in this subtree.
     *
     * @return plain text content
     */
    public String asText() {
        if (isText()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        for (DocNode child : children) {
            sb.append(child.asText());
        }
        return sb.toString();
    }

    /**
     * Lists all descendants in document (pre-)order, excluding this node.
     *
     * @return descendants
     */
    public List<DocNode> descendants() {
        List<DocNode> result = new ArrayList<>();
        collectDescendants(this, result);
        return result;
    }

    /**
     * Returns the last descendant in document order.
     *
     * @return last descendant, or empty for a leaf
     */
    public Optional<DocNode> lastDescendant() {
        DocNode current = this;
        while (!current.children.isEmpty()) {
            current = current.children.get(current.children.size() - 1);
        }
        return current == this ? Optional.empty() : Optional.of(current);
    }

    private static void collectDescendants(DocNode node, List<DocNode> result) {
        for (DocNode child : node.children) {
            result.add(child);
            collectDescendants(child, result);
        }
    }

    /**
     * Fluent builder for element nodes, mainly used by readers and tests.
     */
    public static final class Builder {
        private final NodeKind kind;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<DocNode> children = new ArrayList<>();

        private Builder(NodeKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder attribute(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public Builder child(DocNode child) {
            children.add(child);
            return this;
        }

        public Builder child(Builder child) {
            return child(child.build());
        }

        public Builder text(String text) {
            return child(DocNode.text(text));
        }

        public DocNode build() {
            return element(kind, attributes, children);
        }
    }
}
