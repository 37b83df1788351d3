package dev.everydaythings.textmetrics.layout;

/** Advance width of a string in an already chosen font. */
@FunctionalInterface
public interface TextMeasurer {

    double measure(String text);
}
