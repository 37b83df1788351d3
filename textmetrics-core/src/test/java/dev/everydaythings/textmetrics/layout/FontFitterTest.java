package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.DidNotConvergeException;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FontFitterTest {

    private final FontFitter fitter = new FontFitter();

    @Test
    void findsLargestFittingSize() {
        assertEquals(OptionalInt.of(18), fitter.maxFontSize(100, size -> 5.5 * size));
    }

    @Test
    void exactFitIsAccepted() {
        assertEquals(OptionalInt.of(40), fitter.maxFontSize(100, size -> 2.5 * size));
    }

    @Test
    void walksUpFromLowEstimate() {
        assertEquals(OptionalInt.of(44), fitter.maxFontSize(200, s -> s * s / 10.0));
    }

    @Test
    void walksDownFromHighEstimate() {
        assertEquals(OptionalInt.of(16), fitter.maxFontSize(200, s -> 50 * Math.sqrt(s)));
    }

    @Test
    void noSizeForMissingBudget() {
        assertThat(fitter.maxFontSize(Double.NaN, s -> s)).isEmpty();
        assertThat(fitter.maxFontSize(0, s -> s)).isEmpty();
        assertThat(fitter.maxFontSize(-10, s -> s)).isEmpty();
        assertThat(fitter.maxFontSize(Double.POSITIVE_INFINITY, s -> s)).isEmpty();
    }

    @Test
    void noSizeForEmptyText() {
        assertThat(fitter.maxFontSize(100, s -> 0)).isEmpty();
    }

    @Test
    void noSizeWhenEvenOnePixelIsTooWide() {
        assertThat(fitter.maxFontSize(10, s -> 100.0 * s)).isEmpty();
    }

    @Test
    void nonMonotonicWidthHitsEvaluationCap() {
        AtomicInteger calls = new AtomicInteger();
        FontFitter capped = new FontFitter(50);
        assertThatThrownBy(() -> capped.maxFontSize(100, s -> {
            calls.incrementAndGet();
            return 1;
        })).isInstanceOf(DidNotConvergeException.class);
        assertEquals(50, calls.get());
    }

    @Test
    void rejectsTinyEvaluationCap() {
        assertThrows(IllegalArgumentException.class, () -> new FontFitter(1));
    }

    @Property
    void resultIsLocallyOptimal(@ForAll @DoubleRange(min = 1, max = 50) double perPixel,
                                @ForAll @IntRange(min = 100, max = 5000) int budget) {
        OptionalInt result = fitter.maxFontSize(budget, s -> perPixel * s);

        assertThat(result).isPresent();
        int size = result.getAsInt();
        assertThat(Math.ceil(perPixel * size)).isLessThanOrEqualTo(budget);
        assertThat(Math.ceil(perPixel * (size + 1))).isGreaterThan(budget);
    }
}
