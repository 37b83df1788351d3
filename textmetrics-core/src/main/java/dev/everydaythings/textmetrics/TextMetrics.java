package dev.everydaythings.textmetrics;

import dev.everydaythings.textmetrics.layout.FontFitter;
import dev.everydaythings.textmetrics.layout.TextMeasurer;
import dev.everydaythings.textmetrics.layout.WordBreak;
import dev.everydaythings.textmetrics.style.FontDescriptor;
import dev.everydaythings.textmetrics.style.Lengths;
import dev.everydaythings.textmetrics.style.SpacingAddOn;
import dev.everydaythings.textmetrics.style.SpacingModel;
import dev.everydaythings.textmetrics.style.StyleKeys;
import dev.everydaythings.textmetrics.style.StyleSnapshot;
import dev.everydaythings.textmetrics.style.TextPreparation;
import dev.everydaythings.textmetrics.style.TextTransform;
import dev.everydaythings.textmetrics.style.UnitConverter;
import dev.everydaythings.textmetrics.style.WhiteSpace;

import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Measures text: width, wrapped lines, block height and the largest font
 * size that fits a width.
 *
 * <p>Every operation takes an optional text, per-call options and per-call
 * overrides. Styles are merged for each call, later layers winning:
 * <ol>
 *   <li>built-in defaults ({@code 16px}, weight {@code 400}, {@code Helvetica, Arial, sans-serif})</li>
 *   <li>the bound element's computed style</li>
 *   <li>instance overrides given to the builder</li>
 *   <li>per-call options</li>
 *   <li>per-call overrides</li>
 * </ol>
 * When the text is null, the bound element's text is measured instead.
 *
 * <p>Instances are immutable and may be shared between threads as long as
 * the {@link MetricsProvider} allows concurrent use.
 *
 * <pre>{@code
 * TextMetrics metrics = TextMetrics.builder()
 *     .metricsProvider(provider)
 *     .overrides(TextMetricsOptions.builder().fontSize(14).build())
 *     .build();
 *
 * double w = metrics.width("Hello, world!");
 * List<String> lines = metrics.lines("Some longer text", TextMetricsOptions.builder().width(120).build(), null);
 * OptionalInt size = metrics.maxFontSize("Headline", TextMetricsOptions.builder().width(300).build(), null);
 * }</pre>
 */
public final class TextMetrics {

    private static final Logger log = Logger.getLogger(TextMetrics.class.getName());

    private static final Pattern UNITLESS = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final MetricsProvider metricsProvider;
    private final ElementBinding<?> element;
    private final TextMetricsOptions overrides;
    private final FontFitter fontFitter;

    private TextMetrics(Builder builder) {
        this.metricsProvider = builder.metricsProvider;
        this.element = builder.element;
        this.overrides = TextMetricsOptions.orEmpty(builder.overrides);
        this.fontFitter = new FontFitter(builder.maxFitEvaluations);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Metrics for free-standing text with no element bound. */
    public static TextMetrics create(MetricsProvider metricsProvider) {
        return builder().metricsProvider(metricsProvider).build();
    }

    public static TextMetrics create(MetricsProvider metricsProvider, TextMetricsOptions overrides) {
        return builder().metricsProvider(metricsProvider).overrides(overrides).build();
    }

    // ==================================================================================
    // Width
    // ==================================================================================

    public double width(String text) {
        return width(text, null, null);
    }

    /** Width of the bound element's text. */
    public double width(TextMetricsOptions options, TextMetricsOptions overrides) {
        return width(null, options, overrides);
    }

    /**
     * Rendered width in pixels, spacing included. With {@code multiline}
     * set, the width of the widest wrapped line.
     *
     * @throws UnsupportedUnitException    if a length has an unknown unit
     * @throws MissingCapabilityException if no metrics provider is configured
     */
    public double width(String text, TextMetricsOptions options, TextMetricsOptions overrides) {
        Call call = prepare(text, options, overrides);
        return widthOf(call, call.font());
    }

    // ==================================================================================
    // Height
    // ==================================================================================

    public int height(String text) {
        return height(text, null, null);
    }

    public int height(TextMetricsOptions options, TextMetricsOptions overrides) {
        return height(null, options, overrides);
    }

    /**
     * Height of the wrapped text block: line count times line height,
     * rounded up. An unresolvable line height gives 0.
     */
    public int height(String text, TextMetricsOptions options, TextMetricsOptions overrides) {
        Call call = prepare(text, options, overrides);
        FontDescriptor font = call.font();
        double lineHeight = lineHeight(call.styles.get(StyleKeys.LINE_HEIGHT), font.sizePx(), call.baseFontSize);
        double height = Math.ceil(linesOf(call, font).size() * lineHeight);
        return Double.isNaN(height) ? 0 : (int) height;
    }

    // ==================================================================================
    // Lines
    // ==================================================================================

    public List<String> lines(String text) {
        return lines(text, null, null);
    }

    public List<String> lines(TextMetricsOptions options, TextMetricsOptions overrides) {
        return lines(null, options, overrides);
    }

    /**
     * Wrap the text into lines fitting the available width: the first positive one of
     * options {@code width}, override {@code width}, element box width and
     * style {@code width}, minus horizontal padding when an element is bound.
     * With no width at all nothing wraps except at mandatory breaks.
     */
    public List<String> lines(String text, TextMetricsOptions options, TextMetricsOptions overrides) {
        Call call = prepare(text, options, overrides);
        return linesOf(call, call.font());
    }

    // ==================================================================================
    // Max font size
    // ==================================================================================

    public OptionalInt maxFontSize(String text) {
        return maxFontSize(text, null, null);
    }

    public OptionalInt maxFontSize(TextMetricsOptions options, TextMetricsOptions overrides) {
        return maxFontSize(null, options, overrides);
    }

    /**
     * Largest pixel font size at which the text fits the available width.
     *
     * @return the size, or empty when no positive size fits or there is no width
     * @throws DidNotConvergeException if the provider's widths are not monotonic in size
     */
    public OptionalInt maxFontSize(String text, TextMetricsOptions options, TextMetricsOptions overrides) {
        Call call = prepare(text, options, overrides);
        FontDescriptor font = call.font();
        double max = availableWidth(call);
        return fontFitter.maxFontSize(max, size -> widthOf(call, font.withSize(size)));
    }

    // ==================================================================================
    // Private
    // ==================================================================================

    private Call prepare(String text, TextMetricsOptions options, TextMetricsOptions callOverrides) {
        TextMetricsOptions opts = TextMetricsOptions.orEmpty(options);
        TextMetricsOptions over = TextMetricsOptions.orEmpty(callOverrides);

        StyleSnapshot elementStyle = element != null ? element.style() : StyleSnapshot.EMPTY;
        StyleSnapshot styles = StyleSnapshot.layered()
                .layer(StyleSnapshot.DEFAULTS)
                .layer(elementStyle)
                .layer(overrides.asStyle())
                .layer(opts.asStyle())
                .layer(over.asStyle())
                .build();

        WhiteSpace whiteSpace = WhiteSpace.of(styles.get(StyleKeys.WHITE_SPACE));
        String prepared;
        if (text == null && element != null) {
            prepared = whiteSpace.normalize(element.text());
        } else {
            prepared = TextPreparation.prepare(whiteSpace.normalize(text));
        }

        double base = Lengths.leadingNumber(styles.get(StyleKeys.BASE_FONT_SIZE));
        if (!(base > 0)) {
            base = UnitConverter.DEFAULT_BASE_FONT_SIZE;
        }
        return new Call(prepared, opts, over, styles, base);
    }

    private double widthOf(Call call, FontDescriptor font) {
        if (call.text.isEmpty()) {
            return 0;
        }
        TextMeasurer measurer = measurer(font);
        SpacingAddOn spacing = call.spacing();

        if (call.options.multiline()) {
            double widest = 0;
            for (String line : linesOf(call, font)) {
                widest = Math.max(widest, measurer.measure(line) + spacing.widthOf(line));
            }
            return widest;
        }

        String styled = call.styledText();
        return measurer.measure(styled) + spacing.widthOf(styled);
    }

    private List<String> linesOf(Call call, FontDescriptor font) {
        double max = availableWidth(call);
        WordBreak wordBreak = WordBreak.of(call.styles.get(StyleKeys.WORD_BREAK));
        String styled = call.styledText();
        log.fine(() -> String.format("Breaking %d chars in '%s' at %s px (%s)",
                styled.length(), font, Lengths.format(max), wordBreak));
        return wordBreak.breaker().breakLines(styled, max, call.spacing(), measurer(font));
    }

    private double availableWidth(Call call) {
        double max = firstPositive(
                Lengths.leadingInteger(call.options.width()),
                Lengths.leadingInteger(call.overrides.width()),
                element != null ? element.boxWidth() : Double.NaN,
                Lengths.leadingInteger(call.styles.get(StyleKeys.WIDTH)));
        if (element != null) {
            max -= zeroIfNaN(Lengths.leadingInteger(call.styles.get(StyleKeys.PADDING_LEFT)))
                    + zeroIfNaN(Lengths.leadingInteger(call.styles.get(StyleKeys.PADDING_RIGHT)));
        }
        return max;
    }

    private TextMeasurer measurer(FontDescriptor font) {
        if (metricsProvider == null) {
            throw new MissingCapabilityException("No MetricsProvider configured");
        }
        return text -> metricsProvider.measure(font, text);
    }

    /**
     * Line height in pixels: lengths through {@link UnitConverter}, percentages
     * and unitless numbers relative to the font size, keywords such as
     * {@code normal} NaN.
     *
     * @throws UnsupportedUnitException if a length has an unknown unit
     */
    static double lineHeight(String css, double fontSizePx, double baseFontSizePx) {
        if (css == null) return Double.NaN;
        String value = css.trim();
        double number = Lengths.leadingNumber(value);
        if (Double.isNaN(number)) {
            return Double.NaN;
        }
        if (value.endsWith("%")) {
            return number / 100 * fontSizePx;
        }
        if (UNITLESS.matcher(value).matches()) {
            return number * fontSizePx;
        }
        return UnitConverter.toPixels(value, baseFontSizePx);
    }

    private static double firstPositive(double... candidates) {
        for (double c : candidates) {
            if (c > 0) {
                return c;
            }
        }
        return Double.NaN;
    }

    private static double zeroIfNaN(double value) {
        return Double.isNaN(value) ? 0 : value;
    }

    /** Arguments of one operation, resolved once. */
    private static final class Call {

        final String text;
        final TextMetricsOptions options;
        final TextMetricsOptions overrides;
        final StyleSnapshot styles;
        final double baseFontSize;

        Call(String text, TextMetricsOptions options, TextMetricsOptions overrides,
             StyleSnapshot styles, double baseFontSize) {
            this.text = text;
            this.options = options;
            this.overrides = overrides;
            this.styles = styles;
            this.baseFontSize = baseFontSize;
        }

        FontDescriptor font() {
            String shorthand = styles.get(StyleKeys.FONT);
            if (shorthand != null) {
                return FontDescriptor.parse(shorthand, baseFontSize);
            }
            return FontDescriptor.from(styles, baseFontSize);
        }

        SpacingAddOn spacing() {
            return SpacingModel.build(
                    styles.get(StyleKeys.WORD_SPACING),
                    styles.get(StyleKeys.LETTER_SPACING),
                    baseFontSize);
        }

        String styledText() {
            return TextTransform.of(styles.get(StyleKeys.TEXT_TRANSFORM)).apply(text);
        }
    }

    /** Configures a {@link TextMetrics}. Only the metrics provider is needed for free-standing text. */
    public static final class Builder {

        private MetricsProvider metricsProvider;
        private ElementBinding<?> element;
        private TextMetricsOptions overrides;
        private int maxFitEvaluations = FontFitter.DEFAULT_MAX_EVALUATIONS;

        private Builder() {
        }

        public Builder metricsProvider(MetricsProvider metricsProvider) {
            this.metricsProvider = metricsProvider;
            return this;
        }

        /**
         * Bind a host element whose style, box width and text feed every call.
         * Either source may be null; it is only required once it is used.
         */
        public <E> Builder element(E handle, StyleSource<? super E> styleSource, TextSource<? super E> textSource) {
            this.element = handle != null ? new ElementBinding<>(handle, styleSource, textSource) : null;
            return this;
        }

        /** Instance-wide overrides, below per-call options and overrides. */
        public Builder overrides(TextMetricsOptions overrides) {
            this.overrides = overrides;
            return this;
        }

        /** Cap on width evaluations per {@code maxFontSize} search. */
        public Builder maxFitEvaluations(int maxFitEvaluations) {
            this.maxFitEvaluations = maxFitEvaluations;
            return this;
        }

        public TextMetrics build() {
            return new TextMetrics(this);
        }
    }
}
