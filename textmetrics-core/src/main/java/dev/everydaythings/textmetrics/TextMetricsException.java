package dev.everydaythings.textmetrics;

/**
 * Base type for every failure raised by text measurement.
 *
 * <p>All measurement errors are unchecked: they signal either bad input
 * (an unknown CSS unit) or a host that lacks a required capability, and
 * neither can be handled meaningfully inside the layout loop.
 */
public class TextMetricsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TextMetricsException(String message) {
        super(message);
    }

    public TextMetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
