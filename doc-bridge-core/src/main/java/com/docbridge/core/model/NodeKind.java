package com.docbridge.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of document node kinds understood by the translator.
 *
 * <p>Each constant carries the docutils/Sphinx element name it corresponds to. Element names
 * that are not listed map to {@link #UNKNOWN}, which the translator renders as a silent no-op
 * so that new parser constructs never break a conversion.
 */
public enum NodeKind {
    // Structure
    DOCUMENT,
    SECTION,
    TITLE,
    SUBTITLE,
    TOPIC,
    SIDEBAR,
    RUBRIC,
    COMPOUND,
    GLOSSARY,
    TRANSITION,

    // Inline
    TEXT("#text"),
    STRONG,
    EMPHASIS,
    LITERAL,
    LITERAL_STRONG,
    LITERAL_EMPHASIS,
    TITLE_REFERENCE,
    SUBSCRIPT,
    SUPERSCRIPT,
    MANPAGE,
    INLINE,
    ABBREVIATION,

    // Lists
    BULLET_LIST,
    ENUMERATED_LIST,
    LIST_ITEM,
    DEFINITION_LIST,
    DEFINITION_LIST_ITEM,
    TERM,
    DEFINITION,
    CLASSIFIER,
    FIELD_LIST,
    FIELD,
    FIELD_NAME,
    FIELD_BODY,
    OPTION_LIST,
    OPTION_LIST_ITEM,
    OPTION_GROUP,
    OPTION,
    OPTION_STRING,
    OPTION_ARGUMENT,
    DESCRIPTION,

    // Blocks
    PARAGRAPH,
    COMPACT_PARAGRAPH,
    BLOCK_QUOTE,
    ATTRIBUTION,
    LINE_BLOCK,
    LINE,
    COMMENT,
    LITERAL_BLOCK,
    DOCTEST_BLOCK,
    MATH_BLOCK,
    RAW,
    PROBLEMATIC,
    SYSTEM_MESSAGE,
    CONTAINER,

    // Admonitions
    NOTE,
    TIP,
    WARNING,
    IMPORTANT,
    CAUTION,
    HINT,
    ATTENTION,
    DANGER,
    ERROR,

    // References
    REFERENCE,
    TARGET,
    INDEX,
    DOWNLOAD_REFERENCE,

    // Tables
    TABLE,
    TGROUP,
    COLSPEC,
    TABULAR_COL_SPEC,
    THEAD,
    TBODY,
    ROW,
    ENTRY,

    // Figures
    FIGURE,
    IMAGE,
    CAPTION,
    LEGEND,

    // Footnotes and citations
    FOOTNOTE,
    FOOTNOTE_REFERENCE,
    LABEL,
    CITATION,
    CITATION_REFERENCE,

    // Bibliographic metadata
    DOCINFO,
    AUTHOR,
    VERSION,
    COPYRIGHT,
    DATE,
    REVISION,
    META,
    SUBSTITUTION_DEFINITION,

    // Sphinx object descriptions and other markers
    DESC,
    DESC_SIGNATURE,
    DESC_SIGNATURE_LINE,
    DESC_NAME,
    DESC_ADDNAME,
    DESC_TYPE,
    DESC_RETURNS,
    DESC_PARAMETERLIST,
    DESC_PARAMETER,
    DESC_OPTIONAL,
    DESC_ANNOTATION,
    DESC_CONTENT,
    CENTERED,
    PRODUCTIONLIST,
    SEEALSO,
    TODO_NODE,
    GRAPHVIZ,

    // Pass-through containers
    TOCTREE,
    HLIST,
    HLISTCOL,
    VERSIONMODIFIED,
    GENERATED,

    /** Fallback for element names with no dedicated rendering rules. */
    UNKNOWN("");

    private static final Map<String, NodeKind> BY_TAG_NAME = Arrays.stream(values())
        .filter(kind -> kind != UNKNOWN)
        .collect(Collectors.toUnmodifiableMap(NodeKind::tagName, Function.identity()));

    private final String tagName;

    NodeKind() {
        this.tagName = name().toLowerCase(Locale.ROOT);
    }

    NodeKind(String tagName) {
        this.tagName = tagName;
    }

    /**
     * Returns the docutils element name for this kind.
     *
     * @return element name, {@code #text} for text leaves, empty for {@link #UNKNOWN}
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Resolves a docutils element name to a node kind.
     *
     * @param tagName element name, may be null
     * @return matching kind, or {@link #UNKNOWN}
     */
    public static NodeKind fromTagName(String tagName) {
        if (tagName == null) {
            return UNKNOWN;
        }
        return BY_TAG_NAME.getOrDefault(tagName, UNKNOWN);
    }
}
