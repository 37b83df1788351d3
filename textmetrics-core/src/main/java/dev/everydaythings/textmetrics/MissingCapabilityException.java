package dev.everydaythings.textmetrics;

/**
 * Thrown on first use of a host capability that was never supplied
 * (metrics provider, style source, text source) or that cannot serve
 * requests (e.g. a font manager with no fonts).
 */
public class MissingCapabilityException extends TextMetricsException {

    private static final long serialVersionUID = 1L;

    public MissingCapabilityException(String message) {
        super(message);
    }

    public MissingCapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
