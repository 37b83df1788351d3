package dev.everydaythings.textmetrics;

/**
 * Thrown when the font size search exceeds its evaluation budget, which
 * only happens for width functions that are not monotonic in font size.
 */
public class DidNotConvergeException extends TextMetricsException {

    private static final long serialVersionUID = 1L;

    private final int iterations;
    private final int lastSize;

    public DidNotConvergeException(int iterations, int lastSize) {
        super(String.format("Font size search did not converge after %d evaluations (last size %dpx)",
                iterations, lastSize));
        this.iterations = iterations;
        this.lastSize = lastSize;
    }

    public int iterations() {
        return iterations;
    }

    public int lastSize() {
        return lastSize;
    }
}
