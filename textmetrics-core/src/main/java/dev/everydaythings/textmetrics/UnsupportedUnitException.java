package dev.everydaythings.textmetrics;

/**
 * Thrown when a length carries a unit other than {@code px}, {@code pt},
 * {@code em} or {@code rem}.
 */
public class UnsupportedUnitException extends TextMetricsException {

    private static final long serialVersionUID = 1L;

    private final String unit;

    public UnsupportedUnitException(String unit) {
        super("The unit '" + unit + "' is not supported");
        this.unit = unit;
    }

    /** The offending unit suffix, possibly empty. */
    public String unit() {
        return unit;
    }
}
