package com.docbridge.core.translator.engine;

/**
 * Outcome of an entry rule.
 */
public enum VisitAction {
    /** Descend into the node's children. */
    CONTINUE,
    /** Do not visit the children; the exit rule still runs. */
    SKIP_CHILDREN
}
