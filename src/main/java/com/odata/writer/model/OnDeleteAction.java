package com.odata.writer.model;

import java.util.Locale;

public enum OnDeleteAction {
    NONE,
    CASCADE,
    SET_NULL,
    SET_DEFAULT;

    /**
     * Parse the CSDL {@code OnDelete/@Action} attribute value.
     */
    public static OnDeleteAction fromCsdl(String action) {
        if (action == null || action.isBlank()) {
            return NONE;
        }
        return switch (action.trim().toLowerCase(Locale.ROOT)) {
            case "cascade" -> CASCADE;
            case "setnull" -> SET_NULL;
            case "setdefault" -> SET_DEFAULT;
            default -> NONE;
        };
    }
}
