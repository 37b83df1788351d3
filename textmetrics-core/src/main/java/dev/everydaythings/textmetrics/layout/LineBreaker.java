package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.style.SpacingAddOn;

import java.util.List;

/**
 * Greedy line packing over break opportunities.
 *
 * @see DefaultLineBreaker
 * @see BreakAllLineBreaker
 */
public interface LineBreaker {

    /**
     * Split {@code text} into lines no wider than {@code maxWidthPx} where
     * the break rules allow it. A part that alone exceeds the width stays on
     * its own overflowing line.
     *
     * @param text       normalized text, may be empty
     * @param maxWidthPx available width; {@code NaN} means unbounded
     * @param spacing    word and letter spacing add-on
     * @param measurer   glyph advance widths in the current font
     * @return the lines in reading order
     */
    List<String> breakLines(String text, double maxWidthPx, SpacingAddOn spacing, TextMeasurer measurer);

    /** Effective limit for comparisons: {@code NaN} never triggers a split. */
    static double limit(double maxWidthPx) {
        return Double.isNaN(maxWidthPx) ? Double.POSITIVE_INFINITY : maxWidthPx;
    }
}
