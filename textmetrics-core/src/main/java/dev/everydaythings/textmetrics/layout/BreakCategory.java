package dev.everydaythings.textmetrics.layout;

/**
 * Line break opportunity classes, a curated subset of
 * <a href="http://www.unicode.org/reports/tr14/#Table1">UAX #14</a>.
 *
 * <p>Declaration order is the classification priority.
 */
public enum BreakCategory {
    /** Break opportunity before and after (em dash). */
    B2,
    /** Break after, character removed at the break (spaces, tab, zero width space). */
    BAI,
    /** Soft hyphen: invisible unless the line breaks there, then rendered as {@code -}. */
    SHY,
    /** Break after, character kept at the end of the line (hyphens, word dividers). */
    BA,
    /** Break before, character moves to the start of the next line. */
    BB,
    /** Mandatory break (line feed). */
    BK
}
