package com.docbridge.core.translator.state;

/**
 * Kind of an open list, which decides the list-item marker.
 */
public enum ListKind {
    BULLETED('*'),
    ENUMERATED('.');

    private final char marker;

    ListKind(char marker) {
        this.marker = marker;
    }

    public char marker() {
        return marker;
    }

    /**
     * Builds the item prefix for a nesting depth: the marker repeated {@code depth} times
     * followed by a space.
     *
     * @param depth nesting depth, at least 1
     * @return item prefix
     */
    public String prefix(int depth) {
        return String.valueOf(marker).repeat(depth) + " ";
    }
}
