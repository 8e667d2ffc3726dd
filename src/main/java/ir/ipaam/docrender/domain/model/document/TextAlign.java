package ir.ipaam.docrender.domain.model.document;

import java.util.Locale;

public enum TextAlign {
    LEFT, CENTER, RIGHT, JUSTIFY;

    /** Unknown or missing values fall back to {@link #LEFT}. */
    public static TextAlign parse(String value) {
        if (value == null || value.isBlank()) return LEFT;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "center" -> CENTER;
            case "right" -> RIGHT;
            case "justify" -> JUSTIFY;
            default -> LEFT;
        };
    }
}
