package dev.everydaythings.textmetrics;

/**
 * Reads the visible text content of a host element.
 *
 * @param <E> host element handle type
 */
@FunctionalInterface
public interface TextSource<E> {

    /** Raw text of {@code element}; null is treated as empty. */
    String read(E element);
}
