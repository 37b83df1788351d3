package dev.everydaythings.textmetrics.style;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number parsing and formatting for CSS-ish length strings.
 *
 * <p>Parsing follows the browser's {@code parseInt}/{@code parseFloat}:
 * leading whitespace is skipped, the longest numeric prefix is read and
 * anything after it is ignored. No numeric prefix yields {@code NaN}.
 */
public final class Lengths {

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)(.*)$", Pattern.DOTALL);

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private Lengths() {
    }

    /** Longest leading decimal number of {@code value}, or NaN. */
    public static double leadingNumber(String value) {
        if (value == null) return Double.NaN;
        Matcher m = LEADING_NUMBER.matcher(value);
        return m.matches() ? Double.parseDouble(m.group(1)) : Double.NaN;
    }

    /** Longest leading integer of {@code value}, or NaN. */
    public static double leadingInteger(String value) {
        if (value == null) return Double.NaN;
        Matcher m = LEADING_INTEGER.matcher(value);
        return m.find() ? Double.parseDouble(m.group(1)) : Double.NaN;
    }

    /**
     * Split {@code value} into its numeric prefix and the trimmed remainder.
     *
     * @return {@code null} if the value does not start with a number
     */
    static String[] splitUnit(String value) {
        if (value == null) return null;
        Matcher m = LEADING_NUMBER.matcher(value);
        if (!m.matches()) return null;
        return new String[]{m.group(1), m.group(2).trim()};
    }

    /**
     * Format a pixel amount without a trailing {@code .0}: 16 → "16",
     * 12.5 → "12.5".
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
