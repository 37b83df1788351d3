package dev.everydaythings.textmetrics.style;

/**
 * Extra width contributed by {@code word-spacing} and {@code letter-spacing}
 * on top of the glyph advances reported by the metrics provider.
 */
@FunctionalInterface
public interface SpacingAddOn {

    SpacingAddOn NONE = candidate -> 0;

    /** Extra pixels for rendering {@code candidate}. */
    double widthOf(String candidate);
}
