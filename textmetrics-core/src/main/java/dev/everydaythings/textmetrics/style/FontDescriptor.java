package dev.everydaythings.textmetrics.style;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Font description in CSS {@code font} shorthand order:
 * {@code [weight] [style] [variant] <size>px <family>}.
 *
 * <p>Weight, style and variant are kept only when they are recognized
 * keywords; anything else is dropped rather than rejected. The size is
 * always in pixels.
 *
 * @param weight  font weight keyword or number, or null
 * @param style   {@code normal}, {@code italic} or {@code oblique}, or null
 * @param variant {@code normal} or {@code small-caps}, or null
 * @param sizePx  font size in pixels
 * @param family  comma separated family list, as written
 */
public record FontDescriptor(String weight, String style, String variant, double sizePx, String family) {

    public static final String DEFAULT_FAMILY = "Helvetica, Arial, sans-serif";

    private static final Set<String> WEIGHTS = Set.of(
            "normal", "bold", "bolder", "lighter",
            "100", "200", "300", "400", "500", "600", "700", "800", "900");
    private static final Set<String> STYLES = Set.of("normal", "italic", "oblique");
    private static final Set<String> VARIANTS = Set.of("normal", "small-caps");

    public FontDescriptor {
        weight = weight != null && WEIGHTS.contains(weight) ? weight : null;
        style = style != null && STYLES.contains(style) ? style : null;
        variant = variant != null && VARIANTS.contains(variant) ? variant : null;
        if (family == null || family.isBlank()) {
            family = DEFAULT_FAMILY;
        }
    }

    /**
     * Compose a descriptor from resolved style properties. Missing size,
     * weight and family fall back to the built-in defaults.
     *
     * @throws dev.everydaythings.textmetrics.UnsupportedUnitException if the font size has an unknown unit
     */
    public static FontDescriptor from(StyleSnapshot style, double baseFontSizePx) {
        String defaultSize = StyleSnapshot.DEFAULTS.get(StyleKeys.FONT_SIZE);
        String defaultWeight = StyleSnapshot.DEFAULTS.get(StyleKeys.FONT_WEIGHT);
        return new FontDescriptor(
                style.get(StyleKeys.FONT_WEIGHT, defaultWeight),
                style.get(StyleKeys.FONT_STYLE),
                style.get(StyleKeys.FONT_VARIANT),
                UnitConverter.toPixels(style.get(StyleKeys.FONT_SIZE, defaultSize), baseFontSizePx),
                style.get(StyleKeys.FONT_FAMILY, DEFAULT_FAMILY));
    }

    /**
     * Parse a {@code font} shorthand such as {@code "italic bold 12pt/1.5 'Fira Sans', serif"}.
     * Keywords before the size fill weight, style and variant; a line height
     * after {@code /} is ignored; everything after the size is the family.
     *
     * @throws IllegalArgumentException if no size is present
     * @throws dev.everydaythings.textmetrics.UnsupportedUnitException if the size has an unknown unit
     */
    public static FontDescriptor parse(String shorthand, double baseFontSizePx) {
        String[] tokens = shorthand.trim().split("\\s+");
        String weight = null;
        String style = null;
        String variant = null;
        int i = 0;
        for (; i < tokens.length; i++) {
            String token = tokens[i].toLowerCase(Locale.ROOT);
            if (STYLES.contains(token) && !"normal".equals(token) && style == null) {
                style = token;
            } else if (VARIANTS.contains(token) && !"normal".equals(token) && variant == null) {
                variant = token;
            } else if (WEIGHTS.contains(token) && weight == null) {
                weight = token;
            } else if (!"normal".equals(token)) {
                // "normal" may stand for any of the three, anything else starts the size
                break;
            }
        }
        if (i == tokens.length) {
            throw new IllegalArgumentException("Font shorthand has no size: " + shorthand);
        }
        String sizeToken = tokens[i];
        int slash = sizeToken.indexOf('/');
        if (slash >= 0) {
            sizeToken = sizeToken.substring(0, slash);
        }
        double size = UnitConverter.toPixels(sizeToken, baseFontSizePx);
        String family = String.join(" ", List.of(tokens).subList(i + 1, tokens.length));
        return new FontDescriptor(weight, style, variant, size, family);
    }

    /** Same font at another pixel size. */
    public FontDescriptor withSize(double px) {
        return new FontDescriptor(weight, style, variant, px, family);
    }

    /** Family names in preference order, quotes stripped. */
    public List<String> families() {
        List<String> names = new ArrayList<>();
        for (String part : family.split(",")) {
            String name = part.trim();
            if (name.length() >= 2 && (name.startsWith("\"") && name.endsWith("\"")
                    || name.startsWith("'") && name.endsWith("'"))) {
                name = name.substring(1, name.length() - 1).trim();
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    public boolean isBold() {
        if (weight == null) return false;
        switch (weight) {
            case "bold":
            case "bolder":
            case "600":
            case "700":
            case "800":
            case "900":
                return true;
            default:
                return false;
        }
    }

    public boolean isItalic() {
        return "italic".equals(style) || "oblique".equals(style);
    }

    /** The shorthand string, e.g. {@code "400 16px Helvetica, Arial, sans-serif"}. */
    public String css() {
        List<String> parts = new ArrayList<>(5);
        if (weight != null) parts.add(weight);
        if (style != null) parts.add(style);
        if (variant != null) parts.add(variant);
        parts.add(Lengths.format(sizePx) + "px");
        parts.add(family);
        return String.join(" ", parts);
    }

    @Override
    public String toString() {
        return css();
    }
}
