package com.docbridge.core.translator;

import java.util.Locale;

/**
 * Table column alignment and its AsciiDoc column-spec symbol.
 */
public enum ColumnAlignment {
    LEFT("<"),
    RIGHT(">"),
    CENTER("^"),
    /** No explicit alignment; AsciiDoc applies its own default. */
    UNSPECIFIED("");

    private final String symbol;

    ColumnAlignment(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the symbol used inside a {@code cols} attribute.
     *
     * @return alignment symbol, empty for {@link #UNSPECIFIED}
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Parses a configuration value ({@code left}, {@code right}, {@code center},
     * {@code unspecified}). Blank or null values mean {@link #UNSPECIFIED}.
     *
     * @param value configuration value
     * @return alignment
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static ColumnAlignment fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return UNSPECIFIED;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "left", "<" -> LEFT;
            case "right", ">" -> RIGHT;
            case "center", "centre", "^" -> CENTER;
            case "unspecified", "none", "default" -> UNSPECIFIED;
            default -> throw new IllegalArgumentException("Unsupported column alignment: " + value);
        };
    }
}
