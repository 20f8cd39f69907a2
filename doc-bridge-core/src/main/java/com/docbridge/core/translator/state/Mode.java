package com.docbridge.core.translator.state;

/**
 * Boolean rendering modes tracked during a translation.
 *
 * <p>List and admonition nesting are not modes: they are derived from their stacks.
 */
public enum Mode {
    TABLE,
    FIELD,
    FIGURE,
    LITERAL_BLOCK,
    LINE_BLOCK,
    TOCTREE,
    GLOSSARY,
    TOPIC_CONTENTS,
    DESCRIPTION
}
