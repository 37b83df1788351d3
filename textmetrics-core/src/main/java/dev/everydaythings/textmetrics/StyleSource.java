package dev.everydaythings.textmetrics;

import dev.everydaythings.textmetrics.style.StyleSnapshot;

/**
 * Reads the computed style of a host element.
 *
 * @param <E> host element handle type
 */
public interface StyleSource<E> {

    /** Computed style of {@code element}, with kebab-case keys. */
    StyleSnapshot resolve(E element);

    /**
     * Rendered box width of {@code element} in pixels, or {@code NaN}
     * (or any non-positive value) when the host cannot tell.
     */
    double boxWidth(E element);
}
