package com.docbridge.core.translator.state;

/**
 * How a reference node was opened, which decides how its exit closes it.
 */
public enum ReferenceBranch {
    /** Nothing was emitted on entry; nothing is emitted on exit. */
    SILENT(false),
    /** Link attribute line in front of a wrapped image; the image closes itself. */
    IMAGE_LINK(false),
    /** {@code include::} directive for a navigation collection entry. */
    INCLUDE(true),
    /** Bare or {@code link:} macro for an external address. */
    LINK(true),
    /** {@code xref:} macro to an identifier or another document. */
    CROSS_REFERENCE(true),
    /** Self-referential anchor rendered as a comment; descendants are muted. */
    SELF_ANCHOR(true);

    private final boolean closedWithBracket;

    ReferenceBranch(boolean closedWithBracket) {
        this.closedWithBracket = closedWithBracket;
    }

    public boolean closedWithBracket() {
        return closedWithBracket;
    }
}
