package dev.everydaythings.textmetrics;

import dev.everydaythings.textmetrics.style.Lengths;
import dev.everydaythings.textmetrics.style.StyleKeys;
import dev.everydaythings.textmetrics.style.StyleSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Measurement options and style overrides.
 *
 * <p>The same type serves as per-call options, per-call overrides and
 * instance-wide overrides. Keys may be given in camelCase or kebab-case;
 * they are stored in kebab-case. Besides the named settings any CSS
 * property the pipeline reads ({@code white-space}, {@code word-break},
 * {@code letter-spacing}, {@code font}, ...) can be set with {@link Builder#set}.
 *
 * <pre>{@code
 * TextMetricsOptions opts = TextMetricsOptions.builder()
 *     .fontSize(20)
 *     .fontFamily("DejaVu Sans")
 *     .width(240)
 *     .multiline(true)
 *     .build();
 * }</pre>
 */
public final class TextMetricsOptions {

    public static final TextMetricsOptions EMPTY = new TextMetricsOptions(StyleSnapshot.EMPTY);

    private final StyleSnapshot values;

    private TextMetricsOptions(StyleSnapshot values) {
        this.values = values;
    }

    /** Options from a loosely typed map, e.g. {@code Map.of("fontSize", "20px")}. */
    public static TextMetricsOptions of(Map<String, ?> values) {
        return new TextMetricsOptions(StyleSnapshot.of(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    static TextMetricsOptions orEmpty(TextMetricsOptions options) {
        return options != null ? options : EMPTY;
    }

    /** Raw value for {@code key}, or null. */
    public String get(String key) {
        return values.get(key);
    }

    /** Raw {@code width} value, or null. */
    public String width() {
        return values.get(StyleKeys.WIDTH);
    }

    public boolean multiline() {
        return "true".equalsIgnoreCase(values.get(StyleKeys.MULTILINE));
    }

    /** All values as a style layer. */
    public StyleSnapshot asStyle() {
        return values;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.values.putAll(values.asMap());
        return b;
    }

    @Override
    public String toString() {
        return "TextMetricsOptions" + values.asMap();
    }

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /** Font size in pixels. */
        public Builder fontSize(double px) {
            return set(StyleKeys.FONT_SIZE, Lengths.format(px) + "px");
        }

        /** Font size as a CSS length, e.g. {@code "12pt"}. */
        public Builder fontSize(String css) {
            return set(StyleKeys.FONT_SIZE, css);
        }

        /** Line height in pixels. */
        public Builder lineHeight(double px) {
            return set(StyleKeys.LINE_HEIGHT, Lengths.format(px) + "px");
        }

        /** Line height as CSS: a length, a percentage or a unitless multiplier. */
        public Builder lineHeight(String css) {
            return set(StyleKeys.LINE_HEIGHT, css);
        }

        public Builder fontFamily(String family) {
            return set(StyleKeys.FONT_FAMILY, family);
        }

        public Builder fontWeight(int weight) {
            return set(StyleKeys.FONT_WEIGHT, Integer.toString(weight));
        }

        public Builder fontWeight(String weight) {
            return set(StyleKeys.FONT_WEIGHT, weight);
        }

        /** Box width in pixels. */
        public Builder width(double px) {
            return set(StyleKeys.WIDTH, Lengths.format(px));
        }

        public Builder width(String css) {
            return set(StyleKeys.WIDTH, css);
        }

        /** Whether {@code width} reports the widest wrapped line instead of a single line. */
        public Builder multiline(boolean multiline) {
            return set(StyleKeys.MULTILINE, Boolean.toString(multiline));
        }

        /** Pixels per {@code em}/{@code rem}; 16 when unset. */
        public Builder baseFontSize(double px) {
            return set(StyleKeys.BASE_FONT_SIZE, Lengths.format(px));
        }

        /** A {@code font} shorthand; takes precedence over the individual font properties. */
        public Builder font(String shorthand) {
            return set(StyleKeys.FONT, shorthand);
        }

        /** Any other property; null removes it. */
        public Builder set(String key, Object value) {
            String k = StyleKeys.toKebabCase(key);
            if (value == null) {
                values.remove(k);
            } else {
                values.put(k, value);
            }
            return this;
        }

        public TextMetricsOptions build() {
            return values.isEmpty() ? EMPTY : new TextMetricsOptions(StyleSnapshot.of(values));
        }
    }
}
