package dev.everydaythings.textmetrics.style;

/**
 * Style property names used by the measurement pipeline, plus key
 * normalization ({@code fontSize} → {@code font-size}).
 */
public final class StyleKeys {

    public static final String FONT = "font";
    public static final String FONT_SIZE = "font-size";
    public static final String FONT_WEIGHT = "font-weight";
    public static final String FONT_STYLE = "font-style";
    public static final String FONT_VARIANT = "font-variant";
    public static final String FONT_FAMILY = "font-family";
    public static final String LINE_HEIGHT = "line-height";
    public static final String LETTER_SPACING = "letter-spacing";
    public static final String WORD_SPACING = "word-spacing";
    public static final String WORD_BREAK = "word-break";
    public static final String WHITE_SPACE = "white-space";
    public static final String TEXT_TRANSFORM = "text-transform";
    public static final String WIDTH = "width";
    public static final String PADDING_LEFT = "padding-left";
    public static final String PADDING_RIGHT = "padding-right";
    public static final String MULTILINE = "multiline";
    public static final String BASE_FONT_SIZE = "base-font-size";

    private StyleKeys() {
    }

    /** camelCase → kebab-case; keys already in kebab-case are returned unchanged. */
    public static String toKebabCase(String key) {
        StringBuilder sb = new StringBuilder(key.length() + 4);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                sb.append('-').append((char) (c + ('a' - 'A')));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
