package dev.everydaythings.textmetrics;

import dev.everydaythings.textmetrics.style.FontDescriptor;

/**
 * Host capability that reports the rendered advance width of a string.
 *
 * <p>Implementations must be deterministic for a given font, text and
 * device scale. If they are backed by a shared mutable resource (a single
 * drawing context, a native font face) they serialize access themselves.
 */
@FunctionalInterface
public interface MetricsProvider {

    /**
     * Measure {@code text} rendered with {@code font}.
     *
     * @param font composed font description
     * @param text text to measure, never null
     * @return width in pixels
     */
    double measure(FontDescriptor font, String text);
}
