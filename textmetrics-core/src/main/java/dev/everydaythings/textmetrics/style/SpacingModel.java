package dev.everydaythings.textmetrics.style;

import java.util.Set;

/**
 * Builds the {@link SpacingAddOn} for resolved spacing values.
 *
 * <p>Word spacing is added once per gap between words after whitespace
 * collapsing; letter spacing once per code point of the raw candidate.
 */
public final class SpacingModel {

    private static final Set<String> ZERO_KEYWORDS = Set.of("inherit", "initial", "unset", "normal");

    private SpacingModel() {
    }

    public static SpacingAddOn build(String wordSpacing, String letterSpacing) {
        return build(wordSpacing, letterSpacing, UnitConverter.DEFAULT_BASE_FONT_SIZE);
    }

    /**
     * @throws dev.everydaythings.textmetrics.UnsupportedUnitException if either value has an unknown unit
     */
    public static SpacingAddOn build(String wordSpacing, String letterSpacing, double baseFontSizePx) {
        double wordPx = pixels(wordSpacing, baseFontSizePx);
        double letterPx = pixels(letterSpacing, baseFontSizePx);
        if (wordPx == 0 && letterPx == 0) {
            return SpacingAddOn.NONE;
        }
        return candidate -> {
            int words = WhiteSpace.collapse(candidate).split(" ", -1).length - 1;
            int chars = candidate.codePointCount(0, candidate.length());
            return words * wordPx + chars * letterPx;
        };
    }

    private static double pixels(String value, double baseFontSizePx) {
        if (value == null) return 0;
        String v = value.trim();
        if (v.isEmpty() || ZERO_KEYWORDS.contains(v)) {
            return 0;
        }
        return UnitConverter.toPixels(v, baseFontSizePx);
    }
}
