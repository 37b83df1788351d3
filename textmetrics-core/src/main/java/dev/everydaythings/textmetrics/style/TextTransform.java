package dev.everydaythings.textmetrics.style;

import java.util.Locale;

/** The {@code text-transform} values that change measured glyphs. */
public enum TextTransform {
    NONE,
    UPPERCASE,
    LOWERCASE;

    public static TextTransform of(String css) {
        if (css == null) return NONE;
        switch (css.trim()) {
            case "uppercase":
                return UPPERCASE;
            case "lowercase":
                return LOWERCASE;
            default:
                return NONE;
        }
    }

    public String apply(String text) {
        switch (this) {
            case UPPERCASE:
                return text.toUpperCase(Locale.ROOT);
            case LOWERCASE:
                return text.toLowerCase(Locale.ROOT);
            default:
                return text;
        }
    }
}
