package dev.everydaythings.textmetrics.freetype;

import dev.everydaythings.textmetrics.TextMetricsException;

/**
 * Thrown when font data cannot be read or FreeType rejects it.
 */
public class FontLoadException extends TextMetricsException {

    private static final long serialVersionUID = 1L;

    public FontLoadException(String message) {
        super(message);
    }

    public FontLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
