package com.arxmlviewer.core.model;

import java.util.Locale;

/**
 * Direction of a client-server operation argument.
 */
public enum ArgumentDirection {
    IN,
    OUT,
    INOUT;

    public boolean isInput() {
        return this == IN || this == INOUT;
    }

    public boolean isOutput() {
        return this == OUT || this == INOUT;
    }

    /**
     * Maps the text of a {@code DIRECTION} element.
     *
     * @param text element text, may be null
     * @return matching direction, {@link #IN} for missing or unknown text
     */
    public static ArgumentDirection fromText(String text) {
        if (text == null) {
            return IN;
        }
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "OUT" -> OUT;
            case "INOUT" -> INOUT;
            default -> IN;
        };
    }
}
