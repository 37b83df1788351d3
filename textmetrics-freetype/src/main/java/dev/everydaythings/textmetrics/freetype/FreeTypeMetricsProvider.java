package dev.everydaythings.textmetrics.freetype;

import dev.everydaythings.textmetrics.MetricsProvider;
import dev.everydaythings.textmetrics.style.FontDescriptor;

/**
 * {@link MetricsProvider} that measures text with FreeType glyph advances.
 *
 * <p>Widths are the sum of scaled advances plus kerning, without hinting or
 * shaping, so they track a browser's unhinted layout closely for Latin text.
 */
public class FreeTypeMetricsProvider implements MetricsProvider, AutoCloseable {

    private final FreeTypeFontManager fonts;

    public FreeTypeMetricsProvider(FreeTypeFontManager fonts) {
        this.fonts = fonts;
    }

    /** A provider over a fresh manager populated by {@link FreeTypeFontManager#loadDefaultFonts()}. */
    public static FreeTypeMetricsProvider withDefaultFonts() {
        FreeTypeFontManager fonts = new FreeTypeFontManager();
        fonts.loadDefaultFonts();
        return new FreeTypeMetricsProvider(fonts);
    }

    /**
     * @throws dev.everydaythings.textmetrics.MissingCapabilityException if the manager has no fonts
     */
    @Override
    public double measure(FontDescriptor font, String text) {
        return fonts.measureWidth(font, text);
    }

    public FreeTypeFontManager fonts() {
        return fonts;
    }

    /** Destroys every face of the underlying manager. */
    @Override
    public void close() {
        fonts.destroy();
    }
}
