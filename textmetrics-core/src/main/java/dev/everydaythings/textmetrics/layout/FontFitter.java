package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.DidNotConvergeException;

import java.util.OptionalInt;
import java.util.function.IntToDoubleFunction;
import java.util.logging.Logger;

/**
 * Finds the largest integer font size whose rendered width fits a budget.
 *
 * <p>The search is a local one in two phases. First it estimates: render at
 * half the budget, then rescale the size linearly by how far off that was.
 * Then it walks one pixel at a time, down while the text is too wide or up
 * while the next size still fits. For widths that grow monotonically with
 * the font size the result {@code s} satisfies {@code width(s) <= budget < width(s + 1)}.
 *
 * <p>Every width is rounded up to whole pixels. The number of width
 * evaluations is capped; reaching the cap raises {@link DidNotConvergeException}.
 */
public final class FontFitter {

    private static final Logger log = Logger.getLogger(FontFitter.class.getName());

    public static final int DEFAULT_MAX_EVALUATIONS = 10_000;

    private final int maxEvaluations;

    public FontFitter() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    /**
     * @param maxEvaluations upper bound on calls to the width function per search
     */
    public FontFitter(int maxEvaluations) {
        if (maxEvaluations < 2) {
            throw new IllegalArgumentException("maxEvaluations must be at least 2, got " + maxEvaluations);
        }
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * @param maxWidthPx  width budget in pixels
     * @param widthAtSize rendered width of the text at a given pixel font size
     * @return the fitting size in pixels, or empty if no positive size fits
     * @throws DidNotConvergeException if the evaluation cap is reached
     */
    public OptionalInt maxFontSize(double maxWidthPx, IntToDoubleFunction widthAtSize) {
        if (!(maxWidthPx > 0) || Double.isInfinite(maxWidthPx)) {
            return OptionalInt.empty();
        }
        Probe probe = new Probe(widthAtSize);

        // Estimate: start with half the budget, then scale linearly
        int size = (int) Math.floor(maxWidthPx / 2);
        double cur = probe.widthAt(size);
        if (!(cur > 0)) {
            log.fine(() -> "Nothing to fit: zero width at the seed size");
            return OptionalInt.empty();
        }
        size = toSize(Math.floor(size / cur * maxWidthPx));
        cur = probe.widthAt(size);

        if (cur == maxWidthPx) {
            return result(size, probe);
        }

        // Walk one pixel at a time
        if (cur > maxWidthPx && size > 0) {
            do {
                size -= 1;
                cur = probe.widthAt(size);
            } while (cur > maxWidthPx && size > 0);
        } else {
            while (cur < maxWidthPx) {
                double next = probe.widthAt(size + 1);
                if (next > maxWidthPx) {
                    return result(size, probe);
                }
                size += 1;
                cur = next;
            }
        }
        return result(size, probe);
    }

    private static OptionalInt result(int size, Probe probe) {
        int evaluations = probe.evaluations;
        log.fine(() -> String.format("Font size search settled at %dpx after %d evaluations", size, evaluations));
        return size > 0 ? OptionalInt.of(size) : OptionalInt.empty();
    }

    private static int toSize(double value) {
        if (value >= Integer.MAX_VALUE - 1) return Integer.MAX_VALUE - 1;
        return Math.max(0, (int) value);
    }

    /** Counts width evaluations and enforces the cap. */
    private final class Probe {

        private final IntToDoubleFunction widthAtSize;
        private int evaluations;

        Probe(IntToDoubleFunction widthAtSize) {
            this.widthAtSize = widthAtSize;
        }

        double widthAt(int size) {
            if (evaluations >= maxEvaluations) {
                throw new DidNotConvergeException(evaluations, size);
            }
            evaluations++;
            return Math.ceil(widthAtSize.applyAsDouble(size));
        }
    }
}
