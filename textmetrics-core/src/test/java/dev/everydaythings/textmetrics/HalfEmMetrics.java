package dev.everydaythings.textmetrics;

import dev.everydaythings.textmetrics.style.FontDescriptor;

/**
 * Monospaced test metrics: every code point advances half the font size,
 * except soft hyphens and zero width spaces which have no advance.
 */
public final class HalfEmMetrics implements MetricsProvider {

    @Override
    public double measure(FontDescriptor font, String text) {
        return advances(text) * font.sizePx() / 2;
    }

    /** Number of code points that take up space. */
    public static long advances(String text) {
        return text.codePoints().filter(cp -> cp != 0x00AD && cp != 0x200B).count();
    }
}
