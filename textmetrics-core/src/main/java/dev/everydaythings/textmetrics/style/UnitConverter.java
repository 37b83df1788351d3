package dev.everydaythings.textmetrics.style;

import dev.everydaythings.textmetrics.UnsupportedUnitException;

/**
 * Converts CSS lengths to pixels.
 *
 * <p>Only {@code px}, {@code pt}, {@code em} and {@code rem} are understood;
 * {@code em} and {@code rem} both resolve against a single base font size
 * since there is no element tree to inherit from.
 */
public final class UnitConverter {

    /** Base font size used when none is configured. */
    public static final double DEFAULT_BASE_FONT_SIZE = 16;

    /** CSS reference: 96 px per inch, 72 pt per inch. */
    private static final double PX_PER_PT = 96.0 / 72.0;

    private UnitConverter() {
    }

    public static double toPixels(String value) {
        return toPixels(value, DEFAULT_BASE_FONT_SIZE);
    }

    /**
     * Convert {@code value} to pixels.
     *
     * @param value          a length such as {@code "12pt"} or {@code "1.5rem"}
     * @param baseFontSizePx pixels per {@code em}/{@code rem}
     * @throws UnsupportedUnitException if the unit is not one of px, pt, em, rem
     *                                  (a unitless number included)
     */
    public static double toPixels(String value, double baseFontSizePx) {
        String[] parts = Lengths.splitUnit(value);
        if (parts == null) {
            throw new UnsupportedUnitException(value == null ? "" : value.trim());
        }
        double number = Double.parseDouble(parts[0]);
        switch (parts[1]) {
            case "rem":
            case "em":
                return number * baseFontSizePx;
            case "pt":
                return number / PX_PER_PT;
            case "px":
                return number;
            default:
                throw new UnsupportedUnitException(parts[1]);
        }
    }
}
